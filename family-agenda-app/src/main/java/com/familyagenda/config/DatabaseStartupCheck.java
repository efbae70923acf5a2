package com.familyagenda.config;

import com.familyagenda.repository.RelationalStoreGateway;
import com.familyagenda.repository.SchemaContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Probes the database once the application is up. An unreachable database is logged
 * and the service keeps running; requests will fail with 500 until it comes back.
 */
@Component
public class DatabaseStartupCheck implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DatabaseStartupCheck.class);

    private final RelationalStoreGateway store;
    private final SchemaContract schemaContract;
    private final int port;

    public DatabaseStartupCheck(RelationalStoreGateway store,
                                SchemaContract schemaContract,
                                @Value("${server.port:3000}") int port) {
        this.store = store;
        this.schemaContract = schemaContract;
        this.port = port;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            store.query("SELECT 1", (rs, rowNum) -> rs.getInt(1));
            log.info("Database connection established");

            List<String> missing = schemaContract.findMissingCascades();
            if (!missing.isEmpty()) {
                log.error("Tables {} do not cascade deletes from child; deleting a child will fail or leave orphans", missing);
            }
        } catch (DataAccessException e) {
            log.error("Could not connect to the database", e);
        }
        log.info("Family agenda API listening on port {}", port);
    }
}
