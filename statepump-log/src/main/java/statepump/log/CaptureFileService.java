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

package statepump.log;

import org.jetbrains.annotations.NotNull;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.NavigableMap;
import java.util.TreeMap;

import static statepump.log.LogConstants.CAPTURE_FILE_SEQNUM_SEPARATOR;
import static statepump.log.LogConstants.CAPTURE_TEMP_FILE_SUFFIX;

/**
 * Layout of the capture archive on the filesystem. Each partition has a directory beneath the capture
 * root; each file in it holds the consecutive records [first, end) and is named "first-end". Files are
 * created under a temporary name and renamed once complete, so any file with a capture name is whole.
 */
public class CaptureFileService {
  private final Path captureRootDir;

  public CaptureFileService(Path basePath) throws IOException {
    this.captureRootDir = basePath.resolve(LogConstants.CAPTURE_ROOT_DIRECTORY_RELATIVE_PATH);

    Files.createDirectories(captureRootDir);
  }

  /**
   * A capture file, with the range of records its name declares it holds.
   */
  public static class CaptureFile {
    public final Path path;
    public final long firstSeqNum;
    public final long endSeqNum;

    CaptureFile(Path path, long firstSeqNum, long endSeqNum) {
      this.path = path;
      this.firstSeqNum = firstSeqNum;
      this.endSeqNum = endSeqNum;
    }

    public boolean contains(long seqNum) {
      return seqNum >= firstSeqNum && seqNum < endSeqNum;
    }

    @Override
    public String toString() {
      return "CaptureFile{" + path.getFileName() + "}";
    }
  }

  /**
   * @return The partition's capture files keyed by the first sequence number each holds. Where two
   * files start at the same sequence number, the one reaching further is kept.
   */
  @NotNull
  public NavigableMap<Long, CaptureFile> getCaptureFiles(String partitionKey) {
    final NavigableMap<Long, CaptureFile> captureFiles = new TreeMap<>();

    for (File file : allFilesInDirectory(partitionDir(partitionKey))) {
      final CaptureFile captureFile = parseCaptureFile(file.toPath());
      if (captureFile == null) {
        continue;
      }
      captureFiles.merge(captureFile.firstSeqNum, captureFile,
          (a, b) -> a.endSeqNum >= b.endSeqNum ? a : b);
    }

    return captureFiles;
  }

  /**
   * @return A new, empty file to write a batch into before it is committed.
   */
  public Path createTempFile(String partitionKey) throws IOException {
    Files.createDirectories(partitionDir(partitionKey));
    return Files.createTempFile(partitionDir(partitionKey), "batch", CAPTURE_TEMP_FILE_SUFFIX);
  }

  /**
   * Give a completely written temporary file its capture name.
   */
  public Path commit(String partitionKey, Path tempFile, long firstSeqNum, long endSeqNum) throws IOException {
    final Path target = partitionDir(partitionKey).resolve(fileName(firstSeqNum, endSeqNum));
    return Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE);
  }

  private Path partitionDir(String partitionKey) {
    final Path dir = captureRootDir.resolve(partitionKey).normalize();
    if (!dir.startsWith(captureRootDir.normalize()) || dir.equals(captureRootDir.normalize())) {
      throw new IllegalArgumentException("Invalid partition key " + partitionKey);
    }
    return dir;
  }

  private static String fileName(long firstSeqNum, long endSeqNum) {
    return firstSeqNum + CAPTURE_FILE_SEQNUM_SEPARATOR + endSeqNum;
  }

  private static CaptureFile parseCaptureFile(Path path) {
    final String name = path.getFileName().toString();
    final int separator = name.indexOf(CAPTURE_FILE_SEQNUM_SEPARATOR);
    if (separator <= 0 || name.endsWith(CAPTURE_TEMP_FILE_SUFFIX)) {
      return null;
    }

    try {
      final long first = Long.parseLong(name.substring(0, separator));
      final long end = Long.parseLong(name.substring(separator + 1));
      if (first < 0 || end <= first) {
        return null;
      }
      return new CaptureFile(path, first, end);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static File[] allFilesInDirectory(Path dirPath) {
    File[] files = dirPath.toFile().listFiles();
    if (files == null) {
      return new File[]{};
    } else {
      return files;
    }
  }
}
