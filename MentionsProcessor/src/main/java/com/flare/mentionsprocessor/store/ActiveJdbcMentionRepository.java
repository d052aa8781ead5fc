package com.flare.mentionsprocessor.store;

import com.flare.mentionsprocessor.config.ActiveJDBCConfig;
import com.flare.mentionsprocessor.model.Mention;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes mentions through the ActiveJDBC {@link Mention} model.
 */
@Component
@Slf4j
public class ActiveJdbcMentionRepository implements MentionRepository {

    private final ActiveJDBCConfig activeJDBCConfig;

    public ActiveJdbcMentionRepository(ActiveJDBCConfig activeJDBCConfig) {
        this.activeJDBCConfig = activeJDBCConfig;
    }

    @Override
    public InsertResult insert(Map<String, Object> row) {
        boolean connectionOpened = activeJDBCConfig.openIfAbsent();
        try {
            Mention mention = new Mention();
            for (Map.Entry<String, Object> column : row.entrySet()) {
                mention.set(column.getKey(), column.getValue());
            }

            if (!mention.save()) {
                return InsertResult.failed("validation failed: " + mention.errors());
            }
            return InsertResult.inserted(mention.getId());
        } finally {
            activeJDBCConfig.close(connectionOpened);
        }
    }
}
