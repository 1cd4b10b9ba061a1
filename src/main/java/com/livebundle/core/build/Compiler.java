package com.livebundle.core.build;

import java.nio.file.Path;

/**
 * A bundler that turns a workspace entry file into a single bundle.
 */
@FunctionalInterface
public interface Compiler {

    /**
     * @param entryFile     the application entry point inside the workspace
     * @param workspaceRoot root of the session workspace, used to resolve imports
     * @param options       target platform and dev/minify switches
     * @return the bundle code and optional source map
     * @throws CompileException if the bundler rejects the sources or cannot run
     */
    CompileOutput compile(Path entryFile, Path workspaceRoot, CompileOptions options) throws CompileException;
}
