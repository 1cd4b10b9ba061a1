package com.livebundle.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "livebundle")
public class LivebundleProperties {

    private Sessions sessions = new Sessions();
    private Watch watch = new Watch();
    private Rebuild rebuild = new Rebuild();
    private Build build = new Build();
    private Mutex mutex = new Mutex();

    // -- Flat accessors (delegate to nested) --
    public String getSessionsRoot() { return sessions.root; }
    public String getTemplateDir() { return sessions.templateDir; }
    public List<String> getCopyExcludes() { return sessions.copyExcludes; }
    public boolean isCopySharedComponents() { return sessions.copySharedComponents; }
    public boolean isLoadExistingOnStartup() { return sessions.loadExistingOnStartup; }

    public boolean isWatchExclusive() { return watch.exclusive; }
    public boolean isResumeOnStartup() { return watch.resumeOnStartup; }

    public boolean isRebuildEnabled() { return rebuild.enabled; }
    public long getDebounceMs() { return rebuild.debounceMs; }
    public List<String> getRelevantExtensions() { return rebuild.relevantExtensions; }
    public List<String> getIgnoredPathMarkers() { return rebuild.ignoredPathMarkers; }

    public String getEntryFile() { return build.entryFile; }
    public List<String> getPlatforms() { return build.platforms; }
    public boolean isDev() { return build.dev; }
    public boolean isMinify() { return build.minify; }
    public int getWorkerThreads() { return build.workerThreads; }
    public int getCompileTimeoutSeconds() { return build.compileTimeoutSeconds; }
    public boolean isInitialBuild() { return build.initialBuild; }
    public String getWebCommand() { return build.webCommand; }
    public String getMobileCommand() { return build.mobileCommand; }

    public int getMutexTimeoutSeconds() { return mutex.timeoutSeconds; }

    public Sessions getSessions() { return sessions; }
    public void setSessions(Sessions sessions) { this.sessions = sessions; }
    public Watch getWatch() { return watch; }
    public void setWatch(Watch watch) { this.watch = watch; }
    public Rebuild getRebuild() { return rebuild; }
    public void setRebuild(Rebuild rebuild) { this.rebuild = rebuild; }
    public Build getBuild() { return build; }
    public void setBuild(Build build) { this.build = build; }
    public Mutex getMutex() { return mutex; }
    public void setMutex(Mutex mutex) { this.mutex = mutex; }

    public static class Sessions {
        private String root = "./tmp/live-sessions";
        private String templateDir = "./packages/mobile/src";
        private List<String> copyExcludes = new ArrayList<>(List.of(
                "__tests__", "*.test.*", "*.spec.*",
                ".DS_Store", "node_modules"));
        private boolean copySharedComponents = true;
        private boolean loadExistingOnStartup = true;

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getTemplateDir() { return templateDir; }
        public void setTemplateDir(String templateDir) { this.templateDir = templateDir; }
        public List<String> getCopyExcludes() { return copyExcludes; }
        public void setCopyExcludes(List<String> copyExcludes) { this.copyExcludes = copyExcludes; }
        public boolean isCopySharedComponents() { return copySharedComponents; }
        public void setCopySharedComponents(boolean copySharedComponents) { this.copySharedComponents = copySharedComponents; }
        public boolean isLoadExistingOnStartup() { return loadExistingOnStartup; }
        public void setLoadExistingOnStartup(boolean loadExistingOnStartup) { this.loadExistingOnStartup = loadExistingOnStartup; }
    }

    public static class Watch {
        private boolean exclusive = false;
        private boolean resumeOnStartup = true;

        public boolean isExclusive() { return exclusive; }
        public void setExclusive(boolean exclusive) { this.exclusive = exclusive; }
        public boolean isResumeOnStartup() { return resumeOnStartup; }
        public void setResumeOnStartup(boolean resumeOnStartup) { this.resumeOnStartup = resumeOnStartup; }
    }

    public static class Rebuild {
        private boolean enabled = true;
        private long debounceMs = 1000;
        private List<String> relevantExtensions = new ArrayList<>(List.of(".ts", ".tsx", ".js", ".jsx"));
        private List<String> ignoredPathMarkers = new ArrayList<>(List.of(
                "node_modules/", "__tests__/", ".git/", ".DS_Store", ".test.", ".spec."));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getDebounceMs() { return debounceMs; }
        public void setDebounceMs(long debounceMs) { this.debounceMs = debounceMs; }
        public List<String> getRelevantExtensions() { return relevantExtensions; }
        public void setRelevantExtensions(List<String> relevantExtensions) { this.relevantExtensions = relevantExtensions; }
        public List<String> getIgnoredPathMarkers() { return ignoredPathMarkers; }
        public void setIgnoredPathMarkers(List<String> ignoredPathMarkers) { this.ignoredPathMarkers = ignoredPathMarkers; }
    }

    public static class Build {
        private String entryFile = "App.tsx";
        private List<String> platforms = new ArrayList<>(List.of("android", "ios"));
        private boolean dev = true;
        private boolean minify = false;
        private int workerThreads = 4;
        private int compileTimeoutSeconds = 300;
        private boolean initialBuild = false;
        private String webCommand =
                "npx esbuild {entry} --bundle --outfile={out} --sourcemap --loader:.js=jsx";
        private String mobileCommand =
                "npx react-native bundle --entry-file {entry} --platform {platform} --dev {dev}"
                        + " --minify {minify} --bundle-output {out} --sourcemap-output {sourceMap}";

        public String getEntryFile() { return entryFile; }
        public void setEntryFile(String entryFile) { this.entryFile = entryFile; }
        public List<String> getPlatforms() { return platforms; }
        public void setPlatforms(List<String> platforms) { this.platforms = platforms; }
        public boolean isDev() { return dev; }
        public void setDev(boolean dev) { this.dev = dev; }
        public boolean isMinify() { return minify; }
        public void setMinify(boolean minify) { this.minify = minify; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
        public int getCompileTimeoutSeconds() { return compileTimeoutSeconds; }
        public void setCompileTimeoutSeconds(int compileTimeoutSeconds) { this.compileTimeoutSeconds = compileTimeoutSeconds; }
        public boolean isInitialBuild() { return initialBuild; }
        public void setInitialBuild(boolean initialBuild) { this.initialBuild = initialBuild; }
        public String getWebCommand() { return webCommand; }
        public void setWebCommand(String webCommand) { this.webCommand = webCommand; }
        public String getMobileCommand() { return mobileCommand; }
        public void setMobileCommand(String mobileCommand) { this.mobileCommand = mobileCommand; }
    }

    public static class Mutex {
        private int timeoutSeconds = 30;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
