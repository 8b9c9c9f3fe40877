package io.marshalxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.marshalxform.core.error.ImplicitCollectionException;
import io.marshalxform.core.error.UnmarshallingException;
import io.marshalxform.core.schema.SchemaRegistry;
import io.marshalxform.core.schema.SchemaSettings;
import io.marshalxform.core.testkit.Schemas;
import io.marshalxform.core.testkit.User;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Log events emitted by the engines. */
class MarshallerLoggingTest {

    private ListAppender<ILoggingEvent> marshallerAppender;
    private ListAppender<ILoggingEvent> collectorAppender;
    private Logger marshallerLogger;
    private Logger collectorLogger;

    @BeforeEach
    void setUp() {
        marshallerLogger = (Logger) LoggerFactory.getLogger(Marshaller.class);
        marshallerAppender = attach(marshallerLogger);
        collectorLogger = (Logger) LoggerFactory.getLogger(ErrorCollector.class);
        collectorLogger.setLevel(Level.DEBUG);
        collectorAppender = attach(collectorLogger);
    }

    @AfterEach
    void tearDown() {
        marshallerLogger.detachAppender(marshallerAppender);
        collectorLogger.detachAppender(collectorAppender);
        collectorLogger.setLevel(null);
    }

    private static ListAppender<ILoggingEvent> attach(Logger logger) {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        return appender;
    }

    @Test
    @DisplayName("implicit collection is logged at WARN before raising")
    void implicitCollectionWarns() {
        var schema = Schemas.person(new SchemaRegistry()).newSchema();

        assertThatThrownBy(() -> schema.dump(List.of(new User("Monty"))))
                .isInstanceOf(ImplicitCollectionException.class);

        assertThat(marshallerAppender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("PersonSchema").contains("without many=true");
        });
    }

    @Test
    @DisplayName("strict raise is logged at DEBUG with the schema name")
    void strictRaiseLogsAtDebug() {
        var schema = Schemas.person(new SchemaRegistry())
                .newSchema(SchemaSettings.builder().strict(true).build());

        assertThatThrownBy(() -> schema.load(Map.of("age", "x"))).isInstanceOf(UnmarshallingException.class);

        assertThat(collectorAppender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
            assertThat(event.getFormattedMessage())
                    .isEqualTo("Strict schema PersonSchema raising on loading: Error loading field 'age': "
                            + "'x' cannot be converted to an integer.");
        });
    }

    @Test
    @DisplayName("successful dumps log nothing above DEBUG")
    void successfulDumpIsQuiet() {
        Schemas.person(new SchemaRegistry()).newSchema().dump(new User("Monty", 42));

        assertThat(marshallerAppender.list).isEmpty();
    }
}
