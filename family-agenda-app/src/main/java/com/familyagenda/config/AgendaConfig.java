package com.familyagenda.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Application settings bound from 'familyagenda.*' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "familyagenda")
public class AgendaConfig {

    private Identity identity = new Identity();
    private Ownership ownership = new Ownership();

    public Identity getIdentity() {
        return identity;
    }

    public void setIdentity(Identity identity) {
        this.identity = identity;
    }

    public Ownership getOwnership() {
        return ownership;
    }

    public void setOwnership(Ownership ownership) {
        this.ownership = ownership;
    }

    public static class Identity {
        /** Request header carrying the caller's parent id. */
        private String header = "X-User-Id";

        public String getHeader() { return header; }
        public void setHeader(String header) { this.header = header; }
    }

    public static class Ownership {
        /**
         * When false (the default) delete, schedule-list and schedule-create trust the
         * caller with any child id. When true the caller must be linked to the child.
         */
        private boolean enforce = false;

        public boolean isEnforce() { return enforce; }
        public void setEnforce(boolean enforce) { this.enforce = enforce; }
    }
}
