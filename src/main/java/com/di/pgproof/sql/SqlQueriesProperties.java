package com.di.pgproof.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL for the metadata stores, loaded from sql-queries.yml ({@code pgproof.sql.*}).
 * No SQL is hardcoded in the JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "pgproof.sql")
public class SqlQueriesProperties {

    private Job job = new Job();
    private Audit audit = new Audit();
    private AppliedChange appliedChange = new AppliedChange();
    private Recommendation recommendation = new Recommendation();

    public Job getJob() { return job; }
    public void setJob(Job job) { this.job = job; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }
    public AppliedChange getAppliedChange() { return appliedChange; }
    public void setAppliedChange(AppliedChange appliedChange) { this.appliedChange = appliedChange; }
    public Recommendation getRecommendation() { return recommendation; }
    public void setRecommendation(Recommendation recommendation) { this.recommendation = recommendation; }

    public static class Job {
        private String insert;
        private String markRunning;
        private String markFinished;
        private String updateStatus;
        private String findById;
        private String findRecent;
        private String findByStatus;
        private String findByRecommendation;
        private String deleteFinishedBefore;
        private String countByStatus;
        private String lastActivity;
        private String averageDurationMs;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getMarkRunning() { return markRunning; }
        public void setMarkRunning(String markRunning) { this.markRunning = markRunning; }
        public String getMarkFinished() { return markFinished; }
        public void setMarkFinished(String markFinished) { this.markFinished = markFinished; }
        public String getUpdateStatus() { return updateStatus; }
        public void setUpdateStatus(String updateStatus) { this.updateStatus = updateStatus; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
        public String getFindByStatus() { return findByStatus; }
        public void setFindByStatus(String findByStatus) { this.findByStatus = findByStatus; }
        public String getFindByRecommendation() { return findByRecommendation; }
        public void setFindByRecommendation(String findByRecommendation) { this.findByRecommendation = findByRecommendation; }
        public String getDeleteFinishedBefore() { return deleteFinishedBefore; }
        public void setDeleteFinishedBefore(String deleteFinishedBefore) { this.deleteFinishedBefore = deleteFinishedBefore; }
        public String getCountByStatus() { return countByStatus; }
        public void setCountByStatus(String countByStatus) { this.countByStatus = countByStatus; }
        public String getLastActivity() { return lastActivity; }
        public void setLastActivity(String lastActivity) { this.lastActivity = lastActivity; }
        public String getAverageDurationMs() { return averageDurationMs; }
        public void setAverageDurationMs(String averageDurationMs) { this.averageDurationMs = averageDurationMs; }
    }

    public static class Audit {
        private String insert;
        private String findRecent;
        private String findByRecommendation;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
        public String getFindByRecommendation() { return findByRecommendation; }
        public void setFindByRecommendation(String findByRecommendation) { this.findByRecommendation = findByRecommendation; }
    }

    public static class AppliedChange {
        private String upsert;
        private String findByRecommendation;
        private String findAll;
        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getFindByRecommendation() { return findByRecommendation; }
        public void setFindByRecommendation(String findByRecommendation) { this.findByRecommendation = findByRecommendation; }
        public String getFindAll() { return findAll; }
        public void setFindAll(String findAll) { this.findAll = findAll; }
    }

    public static class Recommendation {
        private String findById;
        private String updateApplyState;
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getUpdateApplyState() { return updateApplyState; }
        public void setUpdateApplyState(String updateApplyState) { this.updateApplyState = updateApplyState; }
    }
}
