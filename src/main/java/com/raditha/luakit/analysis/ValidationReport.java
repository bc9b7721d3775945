package com.raditha.luakit.analysis;

import java.util.List;

/**
 * Findings of {@link ObfuscationValidator}. Errors mean the chunk could not
 * be processed; warnings point at code an obfuscator may break.
 */
public record ValidationReport(List<String> warnings, List<String> errors) {

    public ValidationReport {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isClean() {
        return warnings.isEmpty() && errors.isEmpty();
    }
}
