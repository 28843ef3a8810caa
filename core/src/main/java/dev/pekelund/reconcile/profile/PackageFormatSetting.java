package dev.pekelund.reconcile.profile;

/**
 * Whether a vendor prints a package column and how it should be read.
 */
public record PackageFormatSetting(boolean enabled, PackageFormatKind kind) {

    public static final PackageFormatSetting DISABLED = new PackageFormatSetting(false, null);

    public PackageFormatSetting {
        if (enabled && kind == null) {
            throw new IllegalArgumentException("An enabled package format needs a kind");
        }
    }

    public static PackageFormatSetting of(PackageFormatKind kind) {
        return kind != null ? new PackageFormatSetting(true, kind) : DISABLED;
    }
}
