package com.lucidchart.pixelcompare;

/** Possible tags for a pixel comparison */
public enum Status {

    PASSED ("Passed", ConsoleColor.ANSI_GREEN),
    FAILED ("Failed", ConsoleColor.ANSI_RED),
    DIFFERENT_SIZE("Different Size", ConsoleColor.ANSI_RED),

    // Only one of the two images exists
    MISSING ("Missing", ConsoleColor.ANSI_RED),
    NEEDS_APPROVAL ("Needs Approval", ConsoleColor.ANSI_PURPLE);

    public final String text;
    public final String ansiColor;

    Status(String text, String ansiColor) {
        this.text = text;
        this.ansiColor = ansiColor;
    }

    /** The status text, colored for a terminal */
    public String colored() {
        return ansiColor + text + ConsoleColor.ANSI_RESET;
    }

    /** Obtain Status from string.  An IllegalArgumentException is thrown if no match is found */
    public static Status parseStatus(String status) {
        if (status == null) throw new IllegalArgumentException("Unable to parse status: null");
        switch (status.toLowerCase().replaceAll("[_ ]","")) {
            case "passed": return Status.PASSED;
            case "failed": return Status.FAILED;
            case "differentsize": return Status.DIFFERENT_SIZE;
            case "missing": return Status.MISSING;
            case "needsapproval": return Status.NEEDS_APPROVAL;
            default:
                throw new IllegalArgumentException("Unable to parse status: " + status);
        }
    }

}
