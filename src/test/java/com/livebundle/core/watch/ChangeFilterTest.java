package com.livebundle.core.watch;

import com.livebundle.core.config.LivebundleProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeFilterTest {

    private final ChangeFilter filter = new ChangeFilter(new LivebundleProperties());

    @ParameterizedTest
    @ValueSource(strings = {"App.tsx", "components/Button.tsx", "utils/format.ts", "index.js",
            "screens/Home.JSX", "~/shared/Card.tsx"})
    @DisplayName("source files are relevant")
    void relevant(String path) {
        assertTrue(filter.isRelevant(path));
    }

    @ParameterizedTest
    @ValueSource(strings = {"README.md", "assets/logo.png", "package.json", "styles.css",
            "node_modules/react/index.js", "components/__tests__/Button.tsx", "App.test.tsx",
            "utils/format.spec.ts", ".git/hooks/pre-commit.js"})
    @DisplayName("assets, dependencies and tests are not relevant")
    void irrelevant(String path) {
        assertFalse(filter.isRelevant(path));
    }

    @Test
    @DisplayName("backslash separators are normalized before matching")
    void windowsSeparators() {
        assertFalse(filter.isRelevant("node_modules\\lib\\index.ts"));
        assertTrue(filter.isRelevant("components\\Button.tsx"));
    }

    @Test
    @DisplayName("blank and null paths are not relevant")
    void blank() {
        assertFalse(filter.isRelevant(null));
        assertFalse(filter.isRelevant(" "));
    }

    @Test
    @DisplayName("custom extension list")
    void customExtensions() {
        var cssFilter = new ChangeFilter(List.of(".CSS"), List.of("vendor/"));

        assertTrue(cssFilter.isRelevant("theme/main.css"));
        assertFalse(cssFilter.isRelevant("vendor/reset.css"));
        assertFalse(cssFilter.isRelevant("App.tsx"));
    }
}
