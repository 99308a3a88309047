package work.bindlang.shared;

/**
 * Build version from the jar manifest, {@code "development"} when running from classes.
 */
public final class Version {
    private Version() {}

    public static String current() {
        String implementationVersion = Version.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : "development";
    }
}
