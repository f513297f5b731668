package com.chipsim.hdlgen.lowering;

import java.util.List;

/**
 * Renders a lowered chip as HDL source text.
 */
public class HdlModuleWriter {

    private final LoweringOptions options;

    public HdlModuleWriter(LoweringOptions options) {
        this.options = options;
    }

    public String write(String originalName, String moduleName, ModuleSignature signature,
                        List<PartStatement> statements) {
        String indent = options.getIndent();
        StringBuilder sb = new StringBuilder();

        for (String line : options.getHeaderLines()) {
            sb.append("// ").append(line).append('\n');
        }
        sb.append("// Original chip: ").append(originalName).append('\n');
        sb.append('\n');
        sb.append("CHIP ").append(moduleName).append(" {\n");
        sb.append(indent).append("IN ").append(signature.inputDeclaration()).append(";\n");
        sb.append(indent).append("OUT ").append(signature.outputDeclaration()).append(";\n");
        sb.append('\n');
        sb.append(indent).append("PARTS:\n");
        for (PartStatement statement : statements) {
            sb.append(indent).append(statement.render()).append('\n');
        }
        sb.append("}\n");
        return sb.toString();
    }
}
