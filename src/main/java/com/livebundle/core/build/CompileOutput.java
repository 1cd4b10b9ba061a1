package com.livebundle.core.build;

/**
 * @param code      bundle contents
 * @param sourceMap source map contents, {@code null} when the bundler produced none
 */
public record CompileOutput(String code, String sourceMap) {}
