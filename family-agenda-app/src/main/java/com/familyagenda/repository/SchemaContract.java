package com.familyagenda.repository;

import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the schema rules the services rely on but never enforce themselves:
 * deleting a child must cascade to its parent links and its schedules.
 */
@Component
public class SchemaContract {

    static final List<String> CASCADING_TABLES = List.of("parent_child", "schedule");

    private final RelationalStoreGateway store;

    public SchemaContract(RelationalStoreGateway store) {
        this.store = store;
    }

    /**
     * @return tables whose foreign key to child lacks ON DELETE CASCADE; empty when the contract holds
     */
    public List<String> findMissingCascades() {
        return store.withConnection(con -> {
            DatabaseMetaData meta = con.getMetaData();
            List<String> missing = new ArrayList<>();
            for (String table : CASCADING_TABLES) {
                if (!cascadesFromChild(meta, table)) {
                    missing.add(table);
                }
            }
            return missing;
        });
    }

    private boolean cascadesFromChild(DatabaseMetaData meta, String table) throws SQLException {
        try (ResultSet keys = meta.getImportedKeys(null, null, table)) {
            while (keys.next()) {
                if ("child".equalsIgnoreCase(keys.getString("PKTABLE_NAME"))
                        && keys.getShort("DELETE_RULE") == DatabaseMetaData.importedKeyCascade) {
                    return true;
                }
            }
        }
        return false;
    }
}
