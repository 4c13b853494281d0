package io.tradeflow.cli.ui;

/// ANSI text styling for CLI output with semantic color methods.
///
/// Provides text formatting methods that apply ANSI escape codes for terminal rendering.
/// All methods return styled strings; output handling is the caller's responsibility.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);  // color enabled
/// System.out.println(styles.checkmark() + " " + styles.bold("Execution completed"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
///
/// @see #of(boolean) factory method for creating instances
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an AnsiStyles instance with specified color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    // --- Internal ---

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    // --- Text Formatting ---

    /// Applies bold formatting.
    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Applies gray color for secondary elements.
    public String gray(String text) {
        return style(text, GRAY);
    }

    // --- Semantic Colors ---

    /// Applies blue for accent/highlight elements.
    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors green on success, red on failure.
    public String successOrError(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : RED);
    }

    // --- Symbols ---

    /// Right arrow for dispatch lines.
    public String arrow() {
        return style("→", BLUE);
    }

    /// Bullet point for lists.
    public String bullet() {
        return style("•", GRAY);
    }

    /// Checkmark for success.
    public String checkmark() {
        return style("✓", GREEN);
    }

    /// Cross mark for failure.
    public String crossmark() {
        return style("✗", RED);
    }
}
