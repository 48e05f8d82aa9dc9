package ca.gc.cra.lens.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads an export file into a generic tree of maps, lists, and scalars.
 *
 * @since 0.1.0
 */
public interface ExportReaderPort {
  /**
   * Parses the export file.
   *
   * @param path export location
   * @return parsed document root
   * @throws IOException when the file cannot be read
   * @throws ca.gc.cra.lens.application.load.MalformedExportException when the file is not valid JSON
   */
  Object read(Path path) throws IOException;
}
