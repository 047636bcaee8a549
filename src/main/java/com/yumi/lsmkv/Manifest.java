package com.yumi.lsmkv;

import com.google.common.hash.Hashing;
import com.yumi.lsmkv.exception.CorruptFileException;
import com.yumi.lsmkv.exception.IOFailureException;
import com.yumi.lsmkv.sst.SstFile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 持久化 Registry 中的文件编号（从新到旧）以及已落盘的最大序号。
 * 先写临时文件再原子重命名，重命名成功即为提交点。
 * 格式: MAGIC(4) persistedSequence(8) count(4) fileId(8)* crc32c(4)
 */
public class Manifest {
    public static final String FILE_NAME = "MANIFEST";
    private static final String TMP_SUFFIX = ".tmp";
    private static final int MAGIC = 0x4D414E49;

    private final Path file;
    private final Path tmpFile;

    public Manifest(Path dir) {
        this.file = dir.resolve(FILE_NAME);
        this.tmpFile = dir.resolve(FILE_NAME + TMP_SUFFIX);
    }

    public boolean exists() {
        return Files.exists(this.file);
    }

    /**
     * @return manifest 不存在时为 empty
     */
    public Optional<Snapshot> load() {
        if (!exists()) {
            return Optional.empty();
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(this.file);
        } catch (IOException e) {
            throw new IOFailureException("读取manifest失败 " + this.file, e);
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            if (buffer.getInt() != MAGIC) {
                throw new CorruptFileException(this.file, "manifest magic不匹配");
            }
            long persistedSequence = buffer.getLong();
            int count = buffer.getInt();
            if (persistedSequence < 0 || count < 0 || bytes.length != 4 + 8 + 4 + count * 8L + 4) {
                throw new CorruptFileException(this.file, "manifest长度不匹配");
            }
            List<Long> fileIds = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                fileIds.add(buffer.getLong());
            }
            int checksum = buffer.getInt();
            if (Hashing.crc32c().hashBytes(bytes, 0, bytes.length - 4).asInt() != checksum) {
                throw new CorruptFileException(this.file, "manifest校验和不匹配");
            }
            return Optional.of(new Snapshot(fileIds, persistedSequence));
        } catch (RuntimeException e) {
            if (e instanceof CorruptFileException) {
                throw e;
            }
            throw new CorruptFileException(this.file, "manifest无法解析", e);
        }
    }

    public void persist(Registry registry) {
        List<Long> fileIds = new ArrayList<>(registry.size());
        for (SstFile sstFile : registry) {
            fileIds.add(sstFile.getFileId());
        }
        persist(fileIds, registry.persistedSequence());
    }

    public void persist(List<Long> fileIds, long persistedSequence) {
        ByteBuffer buffer = ByteBuffer.allocate(4 + 8 + 4 + fileIds.size() * 8 + 4);
        buffer.putInt(MAGIC);
        buffer.putLong(persistedSequence);
        buffer.putInt(fileIds.size());
        for (long fileId : fileIds) {
            buffer.putLong(fileId);
        }
        buffer.putInt(Hashing.crc32c().hashBytes(buffer.array(), 0, buffer.position()).asInt());
        buffer.flip();
        try (FileChannel channel = FileChannel.open(this.tmpFile, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException e) {
            throw new IOFailureException("写入manifest失败 " + this.tmpFile, e);
        }
        try {
            Files.move(this.tmpFile, this.file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IOFailureException("提交manifest失败 " + this.file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    public static final class Snapshot {
        //从新到旧
        private final List<Long> fileIds;
        private final long persistedSequence;

        public Snapshot(List<Long> fileIds, long persistedSequence) {
            this.fileIds = fileIds;
            this.persistedSequence = persistedSequence;
        }

        public List<Long> getFileIds() {
            return fileIds;
        }

        public long getPersistedSequence() {
            return persistedSequence;
        }
    }
}
