/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.scumlang.tools;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Assembles, links, and runs compiled programs with {@code nasm} and {@code clang}, using a small C
 * runtime that calls the program's entry point and prints the result.
 *
 * <p>All intermediate files are written to the work directory given to the constructor.
 */
public final class Toolchain {

  private static final Logger logger = Logger.getLogger(Toolchain.class.getName());

  private static final String RUNTIME_RESOURCE = "/runtime/main.c";

  private static final long TIMEOUT_SECONDS = 60;

  private static final String OS_NAME = System.getProperty("os.name").toLowerCase(Locale.ROOT);

  private final Path workDir;

  public Toolchain(Path workDir) {
    this.workDir = workDir;
  }

  /** Returns true if both {@code nasm} and {@code clang} can be run on this host. */
  public static boolean isAvailable() {
    return canRun("nasm", "-v") && canRun("clang", "--version");
  }

  private static boolean canRun(String... command) {
    try {
      Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
      process.getInputStream().readAllBytes();
      return process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS) && process.exitValue() == 0;
    } catch (IOException e) {
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** The object format nasm should produce for this host. */
  static String objectFormat() {
    if (OS_NAME.contains("win")) {
      return "win64";
    } else if (OS_NAME.contains("mac")) {
      return "macho64";
    }
    return "elf64";
  }

  /**
   * Assembles and links {@code asmSource} as an executable named {@code name}, runs it, and returns
   * the integer it prints.
   */
  public long run(String asmSource, String name) throws ToolchainException {
    try {
      Files.createDirectories(workDir);
      Path asm = workDir.resolve(name + ".s");
      Path obj = workDir.resolve(name + ".o");
      Path exe = workDir.resolve(OS_NAME.contains("win") ? name + ".exe" : name);
      Files.writeString(asm, asmSource, UTF_8);
      exec("nasm", "-f", objectFormat(), "-o", obj.toString(), asm.toString());
      exec("clang", "-o", exe.toString(), runtimeSource().toString(), obj.toString());
      String output = exec(exe.toString()).trim();
      try {
        return Long.parseLong(output);
      } catch (NumberFormatException e) {
        throw new ToolchainException("Unexpected output from " + exe + ": " + output, e);
      }
    } catch (IOException e) {
      throw new ToolchainException("Could not run toolchain: " + e.getMessage(), e);
    }
  }

  /** Copies the C runtime into the work directory (once) and returns its path. */
  private Path runtimeSource() throws IOException {
    Path main = workDir.resolve("main.c");
    if (!Files.exists(main)) {
      String source =
          Resources.toString(Resources.getResource(Toolchain.class, RUNTIME_RESOURCE), UTF_8);
      Files.writeString(main, source, UTF_8);
    }
    return main;
  }

  /** Runs a command in the work directory and returns its combined output. */
  private String exec(String... command) throws IOException, ToolchainException {
    ImmutableList<String> commandLine = ImmutableList.copyOf(command);
    logger.fine(() -> "Running " + String.join(" ", commandLine));
    Process process =
        new ProcessBuilder(commandLine)
            .directory(workDir.toFile())
            .redirectErrorStream(true)
            .start();
    String output = new String(process.getInputStream().readAllBytes(), UTF_8);
    try {
      if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new ToolchainException("Timed out: " + commandLine);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new ToolchainException("Interrupted: " + commandLine, e);
    }
    if (process.exitValue() != 0) {
      logger.warning(
          String.format("%s exited with status %s:\n%s", commandLine, process.exitValue(), output));
      throw new ToolchainException(
          String.format("%s exited with status %s: %s", command[0], process.exitValue(), output));
    }
    return output;
  }
}
