package com.koni.vitals.infrastructure.storage;

import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

import java.io.ByteArrayOutputStream;

/**
 * Parquet output target that collects the encoded file in memory.
 */
class InMemoryOutputFile implements OutputFile {
    
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    
    @Override
    public PositionOutputStream create(long blockSizeHint) {
        return new BufferPositionOutputStream();
    }
    
    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) {
        buffer.reset();
        return new BufferPositionOutputStream();
    }
    
    @Override
    public boolean supportsBlockSize() {
        return false;
    }
    
    @Override
    public long defaultBlockSize() {
        return 0;
    }
    
    byte[] toByteArray() {
        return buffer.toByteArray();
    }
    
    private class BufferPositionOutputStream extends PositionOutputStream {
        
        @Override
        public long getPos() {
            return buffer.size();
        }
        
        @Override
        public void write(int b) {
            buffer.write(b);
        }
        
        @Override
        public void write(byte[] b, int off, int len) {
            buffer.write(b, off, len);
        }
    }
}
