package com.scholary.textextractor.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds candidate files under a root directory.
 *
 * <p>Only regular files whose extension is in the allow-list are returned, including links to
 * regular files. Links to directories are not descended into, so a symlink cycle cannot trap the
 * walk. Traversal errors never escape: they are logged and the files found so far are returned.
 */
@Component
public class FileScanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileScanner.class);

  /**
   * Scan a directory tree.
   *
   * @param root the directory to walk
   * @param extensions allowed extensions, lower-case with leading dot
   * @return matching files in lexical path order
   */
  public List<Path> scan(Path root, Set<String> extensions) {
    List<Path> files = new ArrayList<>();

    if (!Files.isDirectory(root)) {
      LOGGER.error("Error scanning directory: {} is not a readable directory", root);
      return files;
    }

    try {
      Files.walkFileTree(
          root,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (extensions.contains(extensionOf(file)) && isRegularFile(file, attrs)) {
                files.add(file);
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
              LOGGER.warn(
                  "Skipping unreadable path during scan: path={}, error={}", file, e.toString());
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException e) {
              if (e != null) {
                LOGGER.warn("Directory listing aborted: path={}, error={}", dir, e.toString());
              }
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException | RuntimeException e) {
      LOGGER.error(
          "Error scanning directory: root={}, filesFoundSoFar={}", root, files.size(), e);
    }

    files.sort(Comparator.comparing(Path::toString));
    LOGGER.debug("Scan complete: root={}, files={}", root, files.size());
    return files;
  }

  /**
   * Regular file test for a walk entry. A link to a regular file counts; its own attributes do not
   * say so, so the target is resolved.
   */
  private static boolean isRegularFile(Path file, BasicFileAttributes attrs) {
    if (attrs.isSymbolicLink()) {
      return Files.isRegularFile(file);
    }
    return attrs.isRegularFile();
  }

  /**
   * Extension of a file name, lower-cased and with the leading dot.
   *
   * <p>Dotfiles such as {@code .gitignore} have no extension.
   */
  public static String extensionOf(Path file) {
    Path name = file.getFileName();
    if (name == null) {
      return "";
    }
    String fileName = name.toString();
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0) {
      return "";
    }
    return fileName.substring(dot).toLowerCase(Locale.ROOT);
  }
}
