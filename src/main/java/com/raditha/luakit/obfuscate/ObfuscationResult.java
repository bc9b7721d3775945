package com.raditha.luakit.obfuscate;

import java.util.List;

/**
 * Output of one obfuscation together with the validator's warnings.
 */
public record ObfuscationResult(String output, List<String> warnings, int renamedLocals, int encodedStrings) {

    public ObfuscationResult {
        warnings = List.copyOf(warnings);
    }
}
