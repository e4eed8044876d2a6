package tech.terrareg.platform.storage;

import java.io.IOException;
import java.io.InputStream;

public enum ArchiveFormat {
    TAR_GZ,
    ZIP;

    /**
     * Detect the format from the stream's magic bytes. The stream must support mark/reset.
     *
     * @return the format, or {@code null} if neither gzip nor zip
     */
    public static ArchiveFormat detect(InputStream in) throws IOException {
        in.mark(4);
        byte[] header = in.readNBytes(4);
        in.reset();
        if (header.length >= 2 && (header[0] & 0xff) == 0x1f && (header[1] & 0xff) == 0x8b) {
            return TAR_GZ;
        }
        if (header.length == 4 && header[0] == 'P' && header[1] == 'K' && header[2] == 3 && header[3] == 4) {
            return ZIP;
        }
        return null;
    }
}
