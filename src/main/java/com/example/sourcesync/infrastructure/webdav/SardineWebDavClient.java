package com.example.sourcesync.infrastructure.webdav;

import com.example.sourcesync.common.config.AppWebDavProperties;
import com.example.sourcesync.domain.model.WebDavDirectoryEntry;
import com.example.sourcesync.domain.model.WebDavDirectoryInfo;
import com.example.sourcesync.domain.model.WebDavFileObject;
import com.github.sardine.DavResource;
import com.github.sardine.Sardine;
import com.github.sardine.impl.SardineException;
import com.github.sardine.impl.SardineImpl;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.HttpClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SardineWebDavClient implements WebDavClient {

    private static final Logger log = LoggerFactory.getLogger(SardineWebDavClient.class);

    private final AppWebDavProperties appWebDavProperties;

    public SardineWebDavClient(AppWebDavProperties appWebDavProperties) {
        this.appWebDavProperties = appWebDavProperties;
    }

    @Override
    public Sardine createSession(String username, String password) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(appWebDavProperties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(appWebDavProperties.getConnectTimeoutMs())
                .setSocketTimeout(appWebDavProperties.getSocketTimeoutMs())
                .build();
        int maxConnections = Math.max(2, appWebDavProperties.getMaxConnectionsPerRoute());
        HttpClientBuilder builder = HttpClientBuilder.create()
                .setDefaultRequestConfig(requestConfig)
                .setMaxConnPerRoute(maxConnections)
                .setMaxConnTotal(maxConnections * 2);
        return new SardineImpl(builder, username, password);
    }

    @Override
    public WebDavDirectoryInfo listDirectory(Sardine session, String directoryUrl, String rootUrl) {
        String dirUrl = ensureDirectoryUrl(directoryUrl);
        String dirKey = normalizeUrl(dirUrl);
        URI rootUri = URI.create(ensureDirectoryUrl(rootUrl));
        String hostPrefix = rootUri.getScheme() + "://" + rootUri.getRawAuthority();

        long start = System.nanoTime();
        try {
            List<DavResource> resources = session.list(dirUrl, 1);
            long responseTimeMs = (System.nanoTime() - start) / 1_000_000L;
            List<WebDavFileObject> files = new ArrayList<>();
            List<WebDavDirectoryEntry> subdirectories = new ArrayList<>();
            String dirEtag = null;
            Date dirLastModified = null;

            for (DavResource resource : resources) {
                String href = resolveHref(dirUrl, hostPrefix, resource.getHref());
                if (dirKey.equals(normalizeUrl(href))) {
                    dirEtag = resource.getEtag();
                    dirLastModified = resource.getModified();
                    continue;
                }
                String relativePath = toRelativePath(rootUrl, href);
                if (relativePath.isEmpty()) {
                    continue;
                }
                if (resource.isDirectory()) {
                    subdirectories.add(new WebDavDirectoryEntry(trimTrailingSlash(relativePath),
                            ensureDirectoryUrl(href), resource.getEtag(), resource.getModified()));
                } else {
                    files.add(new WebDavFileObject(relativePath, href, resource.getEtag(),
                            resource.getModified(), resource.getContentLength(), resource.getContentType()));
                }
            }

            WebDavDirectoryInfo info = new WebDavDirectoryInfo();
            info.setRelativePath(trimTrailingSlash(toRelativePath(rootUrl, dirUrl)));
            info.setDirectoryUrl(dirUrl);
            info.setEtag(dirEtag);
            info.setLastModified(dirLastModified);
            info.setChildCount(files.size() + subdirectories.size());
            info.setFiles(files);
            info.setSubdirectories(subdirectories);
            info.setServerType(detectServerType(rootUrl));
            info.setResponseTimeMs(responseTimeMs);
            log.debug("WEBDAV_LIST_OK url={} files={} dirs={} costMs={}",
                    dirUrl, files.size(), subdirectories.size(), responseTimeMs);
            return info;
        } catch (SardineException e) {
            throw new IllegalStateException(mapSardineException(e), e);
        } catch (IOException e) {
            throw new IllegalStateException("WebDAV listing failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String buildRootUrl(String baseUrl, String rootPath) {
        return ensureDirectoryUrl(buildTargetUrl(baseUrl, rootPath));
    }

    @Override
    public String resolveDirectoryUrl(String rootUrl, String relativePath) {
        String root = ensureDirectoryUrl(rootUrl);
        if (relativePath == null || relativePath.trim().isEmpty() || "/".equals(relativePath.trim())) {
            return root;
        }
        StringBuilder sb = new StringBuilder(root);
        for (String segment : relativePath.replace('\\', '/').split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            sb.append(encodeSegment(segment)).append('/');
        }
        return sb.toString();
    }

    @Override
    public void closeSession(Sardine session) {
        if (session == null) {
            return;
        }
        try {
            session.shutdown();
        } catch (IOException e) {
            log.debug("WEBDAV_SHUTDOWN_FAILED reason={}", e.getMessage());
        }
    }

    static String detectServerType(String rootUrl) {
        String lower = rootUrl == null ? "" : rootUrl.toLowerCase(Locale.ROOT);
        if (lower.contains("/remote.php/")) {
            return "nextcloud";
        }
        if (lower.contains("/dav/") || lower.contains("/webdav/")) {
            return "generic";
        }
        return "unknown";
    }

    private String resolveHref(String currentDir, String hostPrefix, URI href) {
        if (href == null) {
            return currentDir;
        }
        String trimmed = href.toString().trim();
        if (trimmed.isEmpty()) {
            return currentDir;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return trimmed;
        }
        if (trimmed.startsWith("/")) {
            return hostPrefix + trimmed;
        }
        return URI.create(ensureDirectoryUrl(currentDir)).resolve(trimmed).toString();
    }

    private String buildTargetUrl(String baseUrl, String rootPath) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Invalid WebDAV URL: baseUrl is required");
        }
        try {
            URI baseUri = new URI(baseUrl.trim());
            if (baseUri.getScheme() == null || baseUri.getRawAuthority() == null) {
                throw new IllegalArgumentException("Invalid WebDAV URL: scheme and host are required");
            }
            String mergedPath = mergePath(baseUri.getPath(), rootPath);
            return new URI(baseUri.getScheme(), baseUri.getRawAuthority(), mergedPath, null, null).toASCIIString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid WebDAV URL: " + e.getReason());
        }
    }

    private String mergePath(String basePath, String rootPath) {
        String safeBasePath = basePath == null ? "" : basePath.trim();
        if (safeBasePath.endsWith("/") && safeBasePath.length() > 1) {
            safeBasePath = safeBasePath.substring(0, safeBasePath.length() - 1);
        }
        if (rootPath == null || rootPath.trim().isEmpty() || "/".equals(rootPath.trim())) {
            return safeBasePath.isEmpty() ? "/" : safeBasePath;
        }
        String normalizedRootPath = rootPath.trim().replace('\\', '/');
        while (normalizedRootPath.startsWith("//")) {
            normalizedRootPath = normalizedRootPath.substring(1);
        }
        if (!normalizedRootPath.startsWith("/")) {
            normalizedRootPath = "/" + normalizedRootPath;
        }
        String merged = safeBasePath + normalizedRootPath;
        return merged.isEmpty() ? "/" : merged;
    }

    private String toRelativePath(String rootUrl, String href) {
        try {
            String rootPath = URI.create(ensureDirectoryUrl(rootUrl)).getRawPath();
            String hrefPath = URI.create(href).getRawPath();
            String relativePath = hrefPath.startsWith(rootPath) ? hrefPath.substring(rootPath.length()) : hrefPath;
            relativePath = relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
            return URLDecoder.decode(relativePath, StandardCharsets.UTF_8.name());
        } catch (IllegalArgumentException | UnsupportedEncodingException e) {
            log.debug("WEBDAV_RELATIVE_PATH_FAILED rootUrl={} href={}", rootUrl, href);
            return "";
        }
    }

    private static String encodeSegment(String segment) {
        try {
            return URLEncoder.encode(segment, StandardCharsets.UTF_8.name()).replace("+", "%20");
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String trimTrailingSlash(String path) {
        String result = path;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String ensureDirectoryUrl(String url) {
        if (url == null || url.isEmpty()) {
            return url;
        }
        return url.endsWith("/") ? url : url + "/";
    }

    private static String normalizeUrl(String url) {
        if (url == null || url.isEmpty()) {
            return "";
        }
        String normalized = url;
        while (normalized.endsWith("/") && normalized.length() > 1) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static String mapSardineException(SardineException e) {
        int status = e.getStatusCode();
        if (status == 401 || status == 403) {
            return "WebDAV authentication failed, status=" + status;
        }
        if (status == 404) {
            return "WebDAV directory not found, status=404";
        }
        if (status >= 500) {
            return "WebDAV server error, status=" + status;
        }
        return "WebDAV request failed, status=" + status;
    }
}
