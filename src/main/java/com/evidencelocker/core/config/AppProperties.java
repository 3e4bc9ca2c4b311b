package com.evidencelocker.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private Policy policy = new Policy();
    private Audit audit = new Audit();

    public Policy getPolicy(){ return policy; }
    public Audit getAudit(){ return audit; }

    public static class Policy {
        /** When true a denied resource is reported exactly like a missing one (404). */
        private boolean hideExistence = false;
        public boolean isHideExistence(){ return hideExistence; }
        public void setHideExistence(boolean hideExistence){ this.hideExistence = hideExistence; }
    }

    public static class Audit {
        private int detailMaxLength = 255;
        private int maxDetailEntries = 16;
        private int maxListLimit = 100;

        public int getDetailMaxLength(){ return detailMaxLength; }
        public void setDetailMaxLength(int detailMaxLength){ this.detailMaxLength = detailMaxLength; }

        public int getMaxDetailEntries(){ return maxDetailEntries; }
        public void setMaxDetailEntries(int maxDetailEntries){ this.maxDetailEntries = maxDetailEntries; }

        public int getMaxListLimit(){ return maxListLimit; }
        public void setMaxListLimit(int maxListLimit){ this.maxListLimit = maxListLimit; }
    }
}
