package com.chipsim.hdlgen.diagnostics;

public enum Severity {
    WARNING,
    ERROR
}
