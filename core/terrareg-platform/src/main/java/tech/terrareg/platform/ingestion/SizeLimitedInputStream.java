package tech.terrareg.platform.ingestion;

import tech.terrareg.platform.error.RegistryException;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Fails the upload as invalid input once more than {@code limit} bytes were read.
 */
class SizeLimitedInputStream extends FilterInputStream {

    private final long limit;
    private long count;

    SizeLimitedInputStream(InputStream in, long limit) {
        super(in);
        this.limit = limit;
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b != -1) {
            account(1);
        }
        return b;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        int read = super.read(buffer, offset, length);
        if (read > 0) {
            account(read);
        }
        return read;
    }

    private void account(long bytes) {
        count += bytes;
        if (count > limit) {
            throw RegistryException.invalidInput("Upload exceeds the maximum size of " + limit + " bytes");
        }
    }
}
