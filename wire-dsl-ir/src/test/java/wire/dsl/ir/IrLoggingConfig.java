package wire.dsl.ir;

import org.junit.jupiter.api.BeforeAll;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Routes the `wire.dsl` loggers to the console at the level named by the
/// `java.util.logging.ConsoleHandler.level` system property (INFO if unset).
/// Run with `-Djava.util.logging.ConsoleHandler.level=FINER` to see per-node detail.
public class IrLoggingConfig {

    private static final Logger WIRE = Logger.getLogger("wire.dsl");

    @BeforeAll
    static void configureWireLogging() {
        final Level level = requestedLevel(System.getProperty("java.util.logging.ConsoleHandler.level"));
        WIRE.setLevel(level);
        for (final Handler handler : WIRE.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
                return;
            }
        }
        final var console = new ConsoleHandler();
        console.setLevel(level);
        WIRE.addHandler(console);
        WIRE.setUseParentHandlers(false);
    }

    static Level requestedLevel(String property) {
        if (property == null || property.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(property.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            System.err.println("Ignoring unrecognized logging level '" + property + "'");
            return Level.INFO;
        }
    }
}
