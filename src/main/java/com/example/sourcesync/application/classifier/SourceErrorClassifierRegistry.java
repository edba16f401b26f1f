package com.example.sourcesync.application.classifier;

import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class SourceErrorClassifierRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceErrorClassifierRegistry.class);

    private final Map<ErrorSourceType, SourceErrorClassifier> classifiers = new EnumMap<>(ErrorSourceType.class);

    @Autowired
    public SourceErrorClassifierRegistry(List<SourceErrorClassifier> registered, ObjectMapper objectMapper) {
        this(registered, objectMapper, Clock.systemUTC());
    }

    public SourceErrorClassifierRegistry(List<SourceErrorClassifier> registered, ObjectMapper objectMapper,
                                         Clock clock) {
        for (SourceErrorClassifier classifier : registered) {
            SourceErrorClassifier previous = classifiers.put(classifier.sourceType(), classifier);
            if (previous != null) {
                throw new IllegalStateException("Duplicate classifier for source type "
                        + classifier.sourceType().getCode());
            }
        }
        for (ErrorSourceType type : ErrorSourceType.values()) {
            if (!classifiers.containsKey(type)) {
                classifiers.put(type, new GenericErrorClassifier(type, objectMapper, clock));
                log.info("ERROR_CLASSIFIER_FALLBACK sourceType={}", type.getCode());
            }
        }
    }

    /**
     * Never null; uncovered source types resolve to the generic classifier.
     */
    public SourceErrorClassifier get(ErrorSourceType sourceType) {
        return classifiers.get(sourceType);
    }
}
