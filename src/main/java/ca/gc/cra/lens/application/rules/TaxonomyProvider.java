package ca.gc.cra.lens.application.rules;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Facade that layers taxonomy YAML files over the packaged defaults and compiles the result.
 *
 * @since 0.1.0
 */
public final class TaxonomyProvider {

  /**
   * Loads the default tables, then each extension file in order.
   *
   * @param extensions ordered taxonomy files; may be empty
   * @return compiled taxonomy
   * @throws IOException when any source cannot be read
   */
  public CompiledTaxonomy load(List<Path> extensions) throws IOException {
    Objects.requireNonNull(extensions, "extensions");
    TaxonomyBuilder builder = TaxonomyBuilder.withDefaults();
    for (Path extension : extensions) {
      builder.load(extension);
    }
    return builder.build();
  }
}
