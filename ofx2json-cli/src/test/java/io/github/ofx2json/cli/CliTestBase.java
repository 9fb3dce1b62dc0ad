package io.github.ofx2json.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

/// Base class for all command line tests.
/// - Emits an INFO banner per test.
public class CliTestBase extends CliLoggingConfig {

    static final Logger LOG = Logger.getLogger("io.github.ofx2json.cli");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }
}
