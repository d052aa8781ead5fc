package com.flare.mentionsprocessor.config;

import org.javalite.activejdbc.Base;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * ActiveJDBC Database Configuration
 *
 * Exposes the pooled DataSource to code running on threads that are
 * not managed by Spring. ActiveJDBC connections are thread-bound, so the
 * consumer thread opens and releases its own via {@link #openIfAbsent()}.
 */
@Configuration
@Slf4j
public class ActiveJDBCConfig {

    private final DataSource dataSource;

    public ActiveJDBCConfig(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Opens an ActiveJDBC connection on the current thread if none is attached.
     *
     * @return true when this call opened the connection and the caller must close it
     */
    public boolean openIfAbsent() {
        if (Base.hasConnection()) {
            return false;
        }
        Base.open(dataSource);
        log.debug("Opened ActiveJDBC connection for thread {}", Thread.currentThread().getName());
        return true;
    }

    public void close(boolean opened) {
        if (opened && Base.hasConnection()) {
            Base.close();
            log.debug("ActiveJDBC connection returned to pool");
        }
    }
}
