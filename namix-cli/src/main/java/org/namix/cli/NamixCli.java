package org.namix.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for Namix.
 * Replays model definitions through the naming engine and reports the resulting physical names.
 */
@CommandLine.Command(
        name = "namix",
        mixinStandardHelpOptions = true,
        version = "namix 0.1.0",
        description = "스키마 모델의 물리 이름을 네이밍 컨벤션에 맞게 재작성하는 툴",
        subcommands = {
                RewriteCommand.class
        }
)
public class NamixCli {

    public static CommandLine createCommandLine() {
        return new CommandLine(new NamixCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
