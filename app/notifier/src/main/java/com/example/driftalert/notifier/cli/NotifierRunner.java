package com.example.driftalert.notifier.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/** 起動引数で drift-notify を 1 回実行し、その結果をプロセスの終了コードにする。 */
@Component
@RequiredArgsConstructor
public class NotifierRunner implements ApplicationRunner, ExitCodeGenerator {

  private final NotifyCommand command;
  private volatile int exitCode = NotifyCommand.EXIT_OK;

  @Override
  public void run(ApplicationArguments args) {
    exitCode = NotifyCommand.commandLine(command).execute(args.getSourceArgs());
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
