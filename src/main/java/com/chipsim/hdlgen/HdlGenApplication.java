package com.chipsim.hdlgen;

import com.chipsim.hdlgen.cli.ConvertCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Digital Logic Sim to HDL converter.
 * Lowers chip JSON files saved by Digital Logic Sim into Nand2tetris HDL modules.
 */
public class HdlGenApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand()).execute(args);
        System.exit(exitCode);
    }
}
