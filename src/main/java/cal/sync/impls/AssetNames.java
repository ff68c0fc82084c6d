package cal.sync.impls;

import cal.sync.types.Sha256AndSize;

import java.util.regex.Pattern;

/**
 * Derives store asset names.  An asset name is the first 12 hex digits of the
 * content hash, a dash, and the sanitized file name, e.g.
 * <code>0123456789ab-model.bin</code>.  Equal content under an equal name always
 * maps to the same asset, so re-offloading an unchanged file uploads nothing.
 */
public abstract class AssetNames {

  static final int HASH_PREFIX_LENGTH = 12;

  private static final Pattern SPACES_AND_PARENS = Pattern.compile("[ ()]");
  private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");
  private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9._-]");

  /**
   * Make a file name safe for use as an asset name.  Spaces and parentheses become
   * underscores, runs of underscores collapse to one, and anything else outside
   * <code>[A-Za-z0-9._-]</code> becomes an underscore.
   */
  public static String sanitize(String filename) {
    String s = SPACES_AND_PARENS.matcher(filename).replaceAll("_");
    s = REPEATED_UNDERSCORES.matcher(s).replaceAll("_");
    return DISALLOWED.matcher(s).replaceAll("_");
  }

  public static String assetName(Sha256AndSize content, String filename) {
    return content.hex().substring(0, HASH_PREFIX_LENGTH) + '-' + sanitize(filename);
  }

}
