package org.csits.kex.manager.storage;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.csits.kex.manager.exception.ExportFileNotFoundException;
import org.csits.kex.manager.exception.InvalidFileNameException;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

/**
 * 本地磁盘实现。正式文件位于根目录，临时文件位于根目录下的 .tmp 子目录。
 */
@Slf4j
public class LocalExportFileStorage implements ExportFileStorage {

    static final String TEMP_DIR = ".tmp";

    static final String TEMP_SUFFIX = ".part";

    private final Path root;

    private final Path tempDir;

    public LocalExportFileStorage(Path root) throws IOException {
        this.root = ensureDirectory(root.toAbsolutePath().normalize());
        this.tempDir = ensureDirectory(this.root.resolve(TEMP_DIR));
        log.info("导出文件存储根目录: {}", this.root);
    }

    @Override
    public Resource loadAsResource(String fileName) {
        return new FileSystemResource(requirePublished(fileName));
    }

    @Override
    public OutputStream openTemporary(String fileName) throws IOException {
        Path temp = resolve(tempDir, fileName + TEMP_SUFFIX);
        return Files.newOutputStream(temp, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
    }

    @Override
    public void publish(String fileName) throws IOException {
        Path temp = resolve(tempDir, fileName + TEMP_SUFFIX);
        Path target = resolve(root, fileName);
        if (Files.notExists(temp)) {
            throw new ExportFileNotFoundException(fileName + TEMP_SUFFIX);
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("文件系统不支持原子移动，退化为普通移动: {}", fileName);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("导出文件已发布: {}", target);
    }

    @Override
    public void discard(String fileName) {
        Path temp = resolve(tempDir, fileName + TEMP_SUFFIX);
        if (FileUtils.deleteQuietly(temp.toFile())) {
            log.debug("临时导出文件已删除: {}", temp);
        }
    }

    private Path requirePublished(String fileName) {
        Path file = resolve(root, fileName);
        if (!Files.isRegularFile(file)) {
            throw new ExportFileNotFoundException(fileName);
        }
        return file;
    }

    private Path resolve(Path dir, String fileName) {
        FileNameValidator.validate(fileName);
        Path resolved = dir.resolve(fileName).normalize();
        if (!dir.equals(resolved.getParent())) {
            throw new InvalidFileNameException(fileName);
        }
        return resolved;
    }

    private static Path ensureDirectory(Path dir) throws IOException {
        if (Files.notExists(dir)) {
            Files.createDirectories(dir);
        }
        return dir;
    }
}
