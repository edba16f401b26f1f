package com.example.sourcesync.infrastructure.persistence.mapper;

import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.example.sourcesync.infrastructure.persistence.model.FailureCountRow;
import com.example.sourcesync.infrastructure.persistence.model.FailureSummaryRow;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SourceScanFailureMapper {

    String COLUMNS = "id, user_id, source_type, source_id, resource_path, error_type, error_severity, "
            + "failure_count, consecutive_failures, first_failure_at, last_failure_at, last_retry_at, next_retry_at, "
            + "error_message, error_code, http_status_code, response_time_ms, response_size_bytes, "
            + "resource_depth, estimated_item_count, diagnostic_data, user_excluded, user_notes, "
            + "retry_strategy, max_retries, retry_delay_seconds, resolved, resolved_at, resolution_method, "
            + "resolution_notes, created_at, updated_at";

    @Select("SELECT " + COLUMNS + " FROM source_scan_failure "
            + "WHERE user_id = #{userId} AND source_type = #{sourceType} AND resource_path_md5 = #{resourcePathMd5}")
    SourceScanFailureEntity selectByKey(@Param("userId") Long userId,
                                        @Param("sourceType") String sourceType,
                                        @Param("resourcePathMd5") String resourcePathMd5);

    @Select("SELECT " + COLUMNS + " FROM source_scan_failure WHERE id = #{id} AND user_id = #{userId}")
    SourceScanFailureEntity selectById(@Param("userId") Long userId, @Param("id") Long id);

    @Insert("INSERT INTO source_scan_failure(user_id, source_type, source_id, resource_path, resource_path_md5, "
            + "error_type, "
            + "error_severity, failure_count, consecutive_failures, first_failure_at, last_failure_at, "
            + "next_retry_at, error_message, error_code, http_status_code, response_time_ms, response_size_bytes, "
            + "resource_depth, estimated_item_count, diagnostic_data, user_excluded, retry_strategy, max_retries, "
            + "retry_delay_seconds, resolved) "
            + "VALUES(#{userId}, #{sourceType}, #{sourceId}, #{resourcePath}, #{resourcePathMd5}, #{errorType}, "
            + "#{errorSeverity}, #{failureCount}, #{consecutiveFailures}, #{firstFailureAt}, #{lastFailureAt}, "
            + "#{nextRetryAt}, #{errorMessage}, #{errorCode}, #{httpStatusCode}, #{responseTimeMs}, "
            + "#{responseSizeBytes}, #{resourceDepth}, #{estimatedItemCount}, #{diagnosticData}, 0, "
            + "#{retryStrategy}, #{maxRetries}, #{retryDelaySeconds}, 0)")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SourceScanFailureEntity entity);

    /**
     * Applies a new occurrence. Guarded by the failure count read before the update, so a concurrent
     * writer makes this return 0 and the caller re-reads.
     */
    @Update("UPDATE source_scan_failure SET source_id = #{e.sourceId}, error_type = #{e.errorType}, "
            + "error_severity = #{e.errorSeverity}, failure_count = #{e.failureCount}, "
            + "consecutive_failures = #{e.consecutiveFailures}, last_failure_at = #{e.lastFailureAt}, "
            + "next_retry_at = #{e.nextRetryAt}, error_message = #{e.errorMessage}, error_code = #{e.errorCode}, "
            + "http_status_code = #{e.httpStatusCode}, response_time_ms = #{e.responseTimeMs}, "
            + "response_size_bytes = #{e.responseSizeBytes}, resource_depth = #{e.resourceDepth}, "
            + "estimated_item_count = #{e.estimatedItemCount}, diagnostic_data = #{e.diagnosticData}, "
            + "retry_strategy = #{e.retryStrategy}, max_retries = #{e.maxRetries}, "
            + "retry_delay_seconds = #{e.retryDelaySeconds}, resolved = 0, resolved_at = NULL, "
            + "resolution_method = NULL, resolution_notes = NULL, updated_at = NOW() "
            + "WHERE id = #{e.id} AND failure_count = #{expectedFailureCount}")
    int updateOccurrence(@Param("e") SourceScanFailureEntity entity,
                         @Param("expectedFailureCount") int expectedFailureCount);

    @Update("UPDATE source_scan_failure SET resolved = 1, resolved_at = #{now}, "
            + "resolution_method = #{method}, resolution_notes = #{notes}, consecutive_failures = 0, "
            + "next_retry_at = NULL, updated_at = NOW() "
            + "WHERE user_id = #{userId} AND source_type = #{sourceType} AND resource_path_md5 = #{resourcePathMd5} "
            + "AND resolved = 0")
    int resolveByKey(@Param("userId") Long userId,
                     @Param("sourceType") String sourceType,
                     @Param("resourcePathMd5") String resourcePathMd5,
                     @Param("method") String method,
                     @Param("notes") String notes,
                     @Param("now") LocalDateTime now);

    @Update("UPDATE source_scan_failure SET resolved = 1, resolved_at = #{now}, "
            + "resolution_method = #{method}, resolution_notes = #{notes}, consecutive_failures = 0, "
            + "next_retry_at = NULL, updated_at = NOW() "
            + "WHERE id = #{id} AND user_id = #{userId} AND resolved = 0")
    int resolveById(@Param("userId") Long userId,
                    @Param("id") Long id,
                    @Param("method") String method,
                    @Param("notes") String notes,
                    @Param("now") LocalDateTime now);

    @Update("UPDATE source_scan_failure SET user_excluded = #{excluded}, user_notes = #{notes}, updated_at = NOW() "
            + "WHERE id = #{id} AND user_id = #{userId}")
    int updateExcluded(@Param("userId") Long userId,
                       @Param("id") Long id,
                       @Param("excluded") boolean excluded,
                       @Param("notes") String notes);

    @Update("UPDATE source_scan_failure SET consecutive_failures = 0, last_retry_at = #{now}, "
            + "next_retry_at = #{now}, user_excluded = 0, "
            + "user_notes = COALESCE(#{notes}, user_notes), updated_at = NOW() "
            + "WHERE id = #{id} AND user_id = #{userId} AND resolved = 0")
    int resetForRetry(@Param("userId") Long userId,
                      @Param("id") Long id,
                      @Param("notes") String notes,
                      @Param("now") LocalDateTime now);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM source_scan_failure "
            + "WHERE user_id = #{userId} AND resolved = 0 AND user_excluded = 0 "
            + "AND next_retry_at &lt;= #{now} AND failure_count &lt; max_retries "
            + "<if test='sourceType != null'> AND source_type = #{sourceType}</if>"
            + " ORDER BY FIELD(error_severity, 'critical', 'high', 'medium', 'low'), next_retry_at ASC "
            + "LIMIT #{limit}"
            + "</script>")
    List<SourceScanFailureEntity> selectRetryCandidates(@Param("userId") Long userId,
                                                        @Param("sourceType") String sourceType,
                                                        @Param("now") LocalDateTime now,
                                                        @Param("limit") int limit);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM source_scan_failure WHERE user_id = #{userId} "
            + "<if test='sourceType != null'> AND source_type = #{sourceType}</if>"
            + "<if test='errorType != null'> AND error_type = #{errorType}</if>"
            + "<if test='severity != null'> AND error_severity = #{severity}</if>"
            + "<if test='!includeResolved'> AND resolved = 0</if>"
            + "<if test='!includeExcluded'> AND user_excluded = 0</if>"
            + " ORDER BY FIELD(error_severity, 'critical', 'high', 'medium', 'low'), last_failure_at DESC "
            + "LIMIT #{limit} OFFSET #{offset}"
            + "</script>")
    List<SourceScanFailureEntity> selectPage(@Param("userId") Long userId,
                                             @Param("sourceType") String sourceType,
                                             @Param("errorType") String errorType,
                                             @Param("severity") String severity,
                                             @Param("includeResolved") boolean includeResolved,
                                             @Param("includeExcluded") boolean includeExcluded,
                                             @Param("limit") int limit,
                                             @Param("offset") int offset);

    @Select("<script>"
            + "SELECT "
            + "COALESCE(SUM(CASE WHEN resolved = 0 AND user_excluded = 0 THEN 1 ELSE 0 END), 0) AS active_failures, "
            + "COALESCE(SUM(CASE WHEN resolved = 1 THEN 1 ELSE 0 END), 0) AS resolved_failures, "
            + "COALESCE(SUM(CASE WHEN user_excluded = 1 THEN 1 ELSE 0 END), 0) AS excluded_resources, "
            + "COALESCE(SUM(CASE WHEN resolved = 0 AND error_severity = 'critical' THEN 1 ELSE 0 END), 0) "
            + "AS critical_failures, "
            + "COALESCE(SUM(CASE WHEN resolved = 0 AND error_severity = 'high' THEN 1 ELSE 0 END), 0) "
            + "AS high_failures, "
            + "COALESCE(SUM(CASE WHEN resolved = 0 AND error_severity = 'medium' THEN 1 ELSE 0 END), 0) "
            + "AS medium_failures, "
            + "COALESCE(SUM(CASE WHEN resolved = 0 AND error_severity = 'low' THEN 1 ELSE 0 END), 0) "
            + "AS low_failures, "
            + "COALESCE(SUM(CASE WHEN resolved = 0 AND user_excluded = 0 AND next_retry_at &lt;= #{now} "
            + "AND failure_count &lt; max_retries THEN 1 ELSE 0 END), 0) AS ready_for_retry "
            + "FROM source_scan_failure WHERE user_id = #{userId}"
            + "<if test='sourceType != null'> AND source_type = #{sourceType}</if>"
            + "</script>")
    FailureSummaryRow selectSummary(@Param("userId") Long userId,
                                    @Param("sourceType") String sourceType,
                                    @Param("now") LocalDateTime now);

    @Select("SELECT source_type AS group_key, COUNT(*) AS total FROM source_scan_failure "
            + "WHERE user_id = #{userId} AND resolved = 0 GROUP BY source_type")
    List<FailureCountRow> countActiveBySourceType(@Param("userId") Long userId);

    @Select("<script>"
            + "SELECT error_type AS group_key, COUNT(*) AS total FROM source_scan_failure "
            + "WHERE user_id = #{userId} AND resolved = 0"
            + "<if test='sourceType != null'> AND source_type = #{sourceType}</if>"
            + " GROUP BY error_type"
            + "</script>")
    List<FailureCountRow> countActiveByErrorType(@Param("userId") Long userId,
                                                 @Param("sourceType") String sourceType);
}
