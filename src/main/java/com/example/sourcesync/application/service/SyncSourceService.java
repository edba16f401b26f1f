package com.example.sourcesync.application.service;

import com.example.sourcesync.api.request.CreateSyncSourceRequest;
import com.example.sourcesync.api.response.SyncSourceResponse;
import com.example.sourcesync.common.config.AppSecurityProperties;
import com.example.sourcesync.common.exception.BusinessException;
import com.example.sourcesync.common.util.AesCryptoUtil;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.model.SyncTarget;
import com.example.sourcesync.infrastructure.persistence.entity.SyncSourceConfigEntity;
import com.example.sourcesync.infrastructure.persistence.mapper.SyncSourceConfigMapper;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SyncSourceService {

    private static final Logger log = LoggerFactory.getLogger(SyncSourceService.class);

    private final SyncSourceConfigMapper syncSourceConfigMapper;
    private final AppSecurityProperties appSecurityProperties;

    public SyncSourceService(SyncSourceConfigMapper syncSourceConfigMapper,
                             AppSecurityProperties appSecurityProperties) {
        this.syncSourceConfigMapper = syncSourceConfigMapper;
        this.appSecurityProperties = appSecurityProperties;
    }

    public SyncSourceResponse createSource(CreateSyncSourceRequest request) {
        ErrorSourceType sourceType = parseSourceType(request.getSourceType());
        String name = requireNonBlank(request.getName(), "SOURCE_INVALID_NAME", "Source name is required");
        String baseUrl = normalizeAndValidateBaseUrl(request.getBaseUrl());
        String username = requireNonBlank(request.getUsername(), "SOURCE_INVALID_USERNAME", "Username is required");
        String password = requireNonBlank(request.getPassword(), "SOURCE_INVALID_PASSWORD", "Password is required");

        SyncSourceConfigEntity entity = new SyncSourceConfigEntity();
        entity.setUserId(request.getUserId());
        entity.setName(name);
        entity.setSourceType(sourceType.getCode());
        entity.setBaseUrl(baseUrl);
        entity.setUsername(username);
        entity.setPasswordEnc(AesCryptoUtil.encrypt(password, appSecurityProperties.getEncryptKey()));
        entity.setRootPath(normalizeRootPath(request.getRootPath()));
        entity.setEnabled(Boolean.FALSE.equals(request.getEnabled()) ? 0 : 1);
        try {
            syncSourceConfigMapper.insert(entity);
        } catch (DuplicateKeyException e) {
            throw new BusinessException("SOURCE_DUPLICATE", "A source with this name already exists",
                    "Choose another name and retry");
        }
        log.info("SYNC_SOURCE_CREATED id={} userId={} type={} baseUrl={}",
                entity.getId(), entity.getUserId(), entity.getSourceType(), baseUrl);
        SyncSourceConfigEntity saved = syncSourceConfigMapper.selectById(entity.getId());
        return toResponse(saved == null ? entity : saved);
    }

    /**
     * Loads the source owned by the user and decrypts its credentials.
     */
    public SyncTarget resolveTarget(Long userId, Long configId) {
        SyncSourceConfigEntity entity = syncSourceConfigMapper.selectById(configId);
        if (entity == null || !entity.getUserId().equals(userId)) {
            throw new BusinessException("404", "Sync source not found: " + configId);
        }
        return toTarget(entity);
    }

    public SyncTarget toTarget(SyncSourceConfigEntity entity) {
        if (!ErrorSourceType.WEBDAV.getCode().equals(entity.getSourceType())) {
            throw new BusinessException("SOURCE_UNSUPPORTED", "Smart sync supports WebDAV sources only",
                    "Use a webdav source");
        }
        if (entity.getEnabled() == null || entity.getEnabled() != 1) {
            throw new BusinessException("SOURCE_DISABLED", "Sync source is disabled: " + entity.getId());
        }
        String password = AesCryptoUtil.decrypt(entity.getPasswordEnc(), appSecurityProperties.getEncryptKey());
        return new SyncTarget(entity.getUserId(), entity.getId(), entity.getBaseUrl(), entity.getUsername(),
                password, entity.getRootPath());
    }

    public List<SyncSourceConfigEntity> listEnabledSources() {
        return syncSourceConfigMapper.selectEnabled();
    }

    public void markSynced(Long configId) {
        syncSourceConfigMapper.touchLastSync(configId);
    }

    private SyncSourceResponse toResponse(SyncSourceConfigEntity entity) {
        return new SyncSourceResponse(entity.getId(), entity.getUserId(), entity.getName(), entity.getSourceType(),
                entity.getBaseUrl(), entity.getUsername(), entity.getRootPath(), entity.getEnabled(),
                entity.getLastSyncAt(), entity.getCreatedAt());
    }

    private ErrorSourceType parseSourceType(String code) {
        if (!StringUtils.hasText(code)) {
            return ErrorSourceType.WEBDAV;
        }
        try {
            return ErrorSourceType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new BusinessException("SOURCE_INVALID_TYPE", e.getMessage(),
                    "Use one of webdav, s3, local, dropbox, gdrive, onedrive");
        }
    }

    private String normalizeAndValidateBaseUrl(String baseUrl) {
        String value = requireNonBlank(baseUrl, "SOURCE_INVALID_URL", "Base URL is required");
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
                throw new BusinessException("SOURCE_INVALID_URL", "Base URL must be an http(s) URL with a host",
                        "Check the base URL and retry");
            }
        } catch (URISyntaxException e) {
            throw new BusinessException("SOURCE_INVALID_URL", "Malformed base URL", "Check the base URL and retry");
        }
        return value.endsWith("/") && value.length() > 1 ? value.substring(0, value.length() - 1) : value;
    }

    private static String normalizeRootPath(String rootPath) {
        if (!StringUtils.hasText(rootPath)) {
            return "/";
        }
        String normalized = rootPath.trim().replace('\\', '/');
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        return normalized;
    }

    private static String requireNonBlank(String value, String code, String message) {
        if (!StringUtils.hasText(value)) {
            throw new BusinessException(code, message, "Fill in the field and retry");
        }
        return value.trim();
    }
}
