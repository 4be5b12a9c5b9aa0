package io.datamap.storage;

import io.datamap.core.DataMapConfiguration;
import io.datamap.core.DataMapConfiguration.DuplicateNamePolicy;
import io.datamap.logging.CapturingSlf4jServiceProvider;
import io.datamap.logging.CapturingSlf4jServiceProvider.LoggedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataMapLoggingTest {

    @BeforeEach
    void resetLog() {
        CapturingSlf4jServiceProvider.reset();
    }

    @Test
    void overwrittenNameIsLoggedAsWarning() {
        DataMap dataMap = new DataMap(DataMapConfiguration.builder()
                .duplicateNamePolicy(DuplicateNamePolicy.OVERWRITE)
                .build());
        dataMap.addWithId(1, Map.of("name", Map.of("en", "Fire")));

        dataMap.addWithId(2, Map.of("name", Map.of("en", "Fire")));

        assertThat(CapturingSlf4jServiceProvider.events(Level.WARN))
                .extracting(LoggedEvent::message)
                .containsExactly("Name en:Fire moved from entry 1 to entry 2");
    }

    @Test
    void addAndRemoveAreLoggedAtDebug() {
        DataMap dataMap = new DataMap();

        dataMap.addWithId(3, Map.of("name", Map.of("en", "Ice")));
        dataMap.remove(3);

        assertThat(CapturingSlf4jServiceProvider.events(Level.DEBUG))
                .extracting(LoggedEvent::message)
                .containsExactly("Added row 3 with names [en:Ice]", "Removed row 3");
        assertThat(CapturingSlf4jServiceProvider.events(Level.WARN)).isEmpty();
        assertThat(CapturingSlf4jServiceProvider.events())
                .extracting(LoggedEvent::logger)
                .containsOnly(DataMap.class.getName());
    }
}
