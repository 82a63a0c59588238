package wire.dsl.ir;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import wire.dsl.parser.WireParser;

import java.util.logging.Logger;

/// Base class for all IR tests.
/// - Emits an INFO banner per test.
/// - Parses and generates in one step.
public class IrTestBase extends IrLoggingConfig {

    static final Logger LOG = Logger.getLogger("wire.dsl.ir");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static IrDocument generate(String source) {
        return IrGenerator.generate(WireParser.parse(source));
    }

    static IrNode.Container container(IrDocument document, String id) {
        return (IrNode.Container) document.project().nodes().get(id);
    }

    static IrNode.Component component(IrDocument document, String id) {
        return (IrNode.Component) document.project().nodes().get(id);
    }
}
