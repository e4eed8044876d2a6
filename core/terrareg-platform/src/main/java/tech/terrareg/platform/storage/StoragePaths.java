package tech.terrareg.platform.storage;

import tech.terrareg.platform.error.PathTraversalException;

/**
 * Path composition for blob storage. Every storage key and every local path
 * derived from user input is built through {@link #safeJoinPaths}.
 *
 * Canonical layout:
 * <pre>
 * modules/&lt;namespace&gt;/&lt;module&gt;/&lt;provider&gt;/&lt;version&gt;/source.{tar.gz|zip}
 * providers/&lt;namespace&gt;/&lt;provider&gt;/&lt;version&gt;/&lt;os&gt;_&lt;arch&gt;.zip
 * upload/&lt;opaque&gt;
 * </pre>
 */
public final class StoragePaths {

    public static final String MODULES_ROOT = "modules";
    public static final String PROVIDERS_ROOT = "providers";
    public static final String UPLOAD_ROOT = "upload";

    public static final String SOURCE_TAR_GZ = "source.tar.gz";
    public static final String SOURCE_ZIP = "source.zip";

    /**
     * Join {@code parts} under {@code base}.
     *
     * A trailing separator is stripped from the base, leading separators are
     * stripped from each part and empty parts are skipped. Any part containing
     * {@code ..} is rejected.
     *
     * @throws PathTraversalException if a part contains {@code ..}
     */
    public static String safeJoinPaths(String base, String... parts) {
        StringBuilder result = new StringBuilder(stripTrailingSeparators(base));
        for (String part : parts) {
            if (part == null) {
                continue;
            }
            if (part.contains("..")) {
                throw new PathTraversalException("Path component contains '..': " + part);
            }
            String cleaned = stripLeadingSeparators(part);
            if (cleaned.isEmpty()) {
                continue;
            }
            if (result.length() > 0 && result.charAt(result.length() - 1) != '/') {
                result.append('/');
            }
            result.append(cleaned);
        }
        return result.toString();
    }

    public static String moduleVersionDirectory(String namespace, String module, String provider, String version) {
        return safeJoinPaths(MODULES_ROOT, namespace, module, provider, version);
    }

    public static String moduleArchive(String namespace, String module, String provider, String version, String archiveName) {
        return safeJoinPaths(moduleVersionDirectory(namespace, module, provider, version), archiveName);
    }

    public static String moduleProviderDirectory(String namespace, String module, String provider) {
        return safeJoinPaths(MODULES_ROOT, namespace, module, provider);
    }

    public static String providerVersionDirectory(String namespace, String provider, String version) {
        return safeJoinPaths(PROVIDERS_ROOT, namespace, provider, version);
    }

    public static String providerBinary(String namespace, String provider, String version, String os, String arch) {
        return safeJoinPaths(providerVersionDirectory(namespace, provider, version), os + "_" + arch + ".zip");
    }

    public static String upload(String opaque) {
        return safeJoinPaths(UPLOAD_ROOT, opaque);
    }

    private static String stripTrailingSeparators(String value) {
        int end = value.length();
        while (end > 0 && isSeparator(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    private static String stripLeadingSeparators(String value) {
        int start = 0;
        while (start < value.length() && isSeparator(value.charAt(start))) {
            start++;
        }
        return value.substring(start);
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }

    private StoragePaths() {
        // Utility class
    }
}
