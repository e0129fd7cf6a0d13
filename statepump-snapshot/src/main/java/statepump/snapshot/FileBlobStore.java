/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package statepump.snapshot;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.WRITE;

/**
 * BlobStore keeping each blob as a file beneath a root directory, at the path named by its key.
 * Blobs are written to a temporary file and moved into place, so a reader never sees part of a blob.
 */
public class FileBlobStore implements BlobStore {
  private static final String TEMP_FILE_SUFFIX = ".tmp";

  private final Path rootDir;

  public FileBlobStore(Path rootDir) throws IOException {
    this.rootDir = rootDir;

    Files.createDirectories(rootDir);
  }

  @Override
  public void put(String key, ByteBuffer[] content) throws IOException {
    final Path target = pathOf(key);
    Files.createDirectories(target.getParent());
    final Path tempFile = Files.createTempFile(target.getParent(), "blob", TEMP_FILE_SUFFIX);

    try {
      try (FileChannel channel = FileChannel.open(tempFile, WRITE)) {
        for (ByteBuffer buffer : content) {
          final ByteBuffer toWrite = buffer.duplicate();
          while (toWrite.hasRemaining()) {
            channel.write(toWrite);
          }
        }
        channel.force(true);
      }
      Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      Files.deleteIfExists(tempFile);
      throw e;
    }
  }

  @Nullable
  @Override
  public InputStream get(String key) throws IOException {
    try {
      return new BufferedInputStream(Files.newInputStream(pathOf(key)));
    } catch (NoSuchFileException e) {
      return null;
    }
  }

  @Override
  public ImmutableList<String> list(String prefix) throws IOException {
    try (Stream<Path> paths = Files.walk(rootDir)) {
      return ImmutableList.copyOf(paths
          .filter(Files::isRegularFile)
          .map(this::keyOf)
          .filter((key) -> key.startsWith(prefix) && !key.endsWith(TEMP_FILE_SUFFIX))
          .sorted()
          .collect(Collectors.toList()));
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  @Override
  public boolean delete(String key) throws IOException {
    return Files.deleteIfExists(pathOf(key));
  }

  private Path pathOf(String key) {
    final Path path = rootDir.resolve(key).normalize();
    if (!path.startsWith(rootDir.normalize()) || key.isEmpty()) {
      throw new IllegalArgumentException("Invalid blob key " + key);
    }
    return path;
  }

  private String keyOf(Path path) {
    return rootDir.relativize(path).toString().replace(path.getFileSystem().getSeparator(), "/");
  }
}
