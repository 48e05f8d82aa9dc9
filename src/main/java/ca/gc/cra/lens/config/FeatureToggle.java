package ca.gc.cra.lens.config;

/**
 * Optional analyze stages that can be switched off.
 *
 * @since 0.1.0
 */
public enum FeatureToggle {
  /** PII redaction and entity pseudonymization ({@code privacyEnabled}, {@code --no-privacy}). */
  PRIVACY("privacyEnabled", "--no-privacy", "Privacy"),
  /** Per-conversation quality metrics ({@code qualityEnabled}, {@code --no-quality}). */
  QUALITY("qualityEnabled", "--no-quality", "Quality"),
  /** Corpus temporal profile ({@code temporalEnabled}, {@code --no-temporal}). */
  TEMPORAL("temporalEnabled", "--no-temporal", "Temporal"),
  /** Chart generation request; recorded but not rendered ({@code visualizationEnabled}, {@code --no-viz}). */
  VISUALIZATION("visualizationEnabled", "--no-viz", "Visualization");

  private final String key;
  private final String disableFlag;
  private final String label;

  FeatureToggle(String key, String disableFlag, String label) {
    this.key = key;
    this.disableFlag = disableFlag;
    this.label = label;
  }

  /** Settings key holding the toggle. */
  public String key() {
    return key;
  }

  /** CLI flag that switches the toggle off. */
  public String disableFlag() {
    return disableFlag;
  }

  /** Display name used in dry-run plans. */
  public String label() {
    return label;
  }
}
