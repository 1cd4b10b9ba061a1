package com.livebundle.core.build;

/**
 * @param platform mobile platform ({@code android}, {@code ios}); {@code null} for the web bundle
 * @param dev      development mode bundle
 * @param minify   minify the output
 */
public record CompileOptions(String platform, boolean dev, boolean minify) {

    public static CompileOptions web(boolean dev, boolean minify) {
        return new CompileOptions(null, dev, minify);
    }

    public static CompileOptions mobile(String platform, boolean dev, boolean minify) {
        return new CompileOptions(platform, dev, minify);
    }
}
