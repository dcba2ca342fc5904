package org.gamma.geobatch.processing;

import org.gamma.geobatch.util.Utils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes CSV rows to an output stream. Only closes the underlying writer when it owns it.
 */
public class CsvRowWriter implements AutoCloseable {
    private final BufferedWriter writer;
    private final boolean ownsWriter;
    private long recordCount = 0L;
    private boolean closed = false;

    public CsvRowWriter(Writer out, boolean ownsWriter) {
        this.writer = out instanceof BufferedWriter bw ? bw : new BufferedWriter(out);
        this.ownsWriter = ownsWriter;
    }

    public long getRecordCount() {
        return this.recordCount;
    }

    public void writeRow(List<String> fields) throws IOException {
        if (this.closed) {
            throw new IOException("Attempted to write to a closed CSV writer");
        }
        this.writer.write(Utils.toCsvLine(fields));
        this.writer.write('\n');
        ++this.recordCount;
    }

    public void flush() throws IOException {
        if (!this.closed) this.writer.flush();
    }

    @Override
    public void close() throws IOException {
        if (this.closed) return;
        this.closed = true;
        if (ownsWriter)
            this.writer.close();
        else
            this.writer.flush();
    }
}
