package com.example.sourcesync.application.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class SourceErrorClassifierRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void registeredClassifiersShouldBeReturnedAndGapsFilled() {
        WebDavErrorClassifier webDav = new WebDavErrorClassifier(objectMapper, clock);
        S3ErrorClassifier s3 = new S3ErrorClassifier(objectMapper, clock);
        SourceErrorClassifierRegistry registry = new SourceErrorClassifierRegistry(
                Arrays.<SourceErrorClassifier>asList(webDav, s3), objectMapper, clock);

        assertSame(webDav, registry.get(ErrorSourceType.WEBDAV));
        assertSame(s3, registry.get(ErrorSourceType.S3));
        for (ErrorSourceType type : ErrorSourceType.values()) {
            assertNotNull(registry.get(type));
            assertEquals(type, registry.get(type).sourceType());
        }
        assertTrue(registry.get(ErrorSourceType.GDRIVE) instanceof GenericErrorClassifier);
    }

    @Test
    void emptyRegistrationShouldFallBackEverywhere() {
        SourceErrorClassifierRegistry registry = new SourceErrorClassifierRegistry(
                Collections.<SourceErrorClassifier>emptyList(), objectMapper, clock);

        assertTrue(registry.get(ErrorSourceType.WEBDAV) instanceof GenericErrorClassifier);
    }

    @Test
    void duplicateRegistrationShouldFail() {
        assertThrows(IllegalStateException.class, () -> new SourceErrorClassifierRegistry(
                Arrays.<SourceErrorClassifier>asList(new WebDavErrorClassifier(objectMapper, clock),
                        new WebDavErrorClassifier(objectMapper, clock)),
                objectMapper, clock));
    }
}
