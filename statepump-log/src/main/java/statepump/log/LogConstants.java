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

import java.nio.file.Path;
import java.nio.file.Paths;

public class LogConstants {
  public static final Path CAPTURE_ROOT_DIRECTORY_RELATIVE_PATH = Paths.get("capture");
  public static final String CAPTURE_FILE_SEQNUM_SEPARATOR = "-";
  public static final String CAPTURE_TEMP_FILE_SUFFIX = ".tmp";
  public static final int ARCHIVE_READ_BUFFER_SIZE = 64 * 1024;
}
