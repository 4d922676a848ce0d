package com.flamingo.ai.chunker.service.chunking;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives the stable identifier of a chunk from its position in a document.
 *
 * <p>The identity is the first 16 hex characters (64 bits) of the MD5 digest of
 *
 * <pre>{@code documentId | path[0] US path[1] US ... | paragraphIndex | subchunkIndex-or-empty}</pre>
 *
 * where {@code US} is the ASCII unit separator (U+001F). An absent sub-chunk index hashes
 * differently from index 0. At 64 bits, collisions within a single corpus are improbable but
 * possible; downstream stores keyed by this value would silently drop the second chunk.
 *
 * <p>Text content is not part of the identity: re-processing an edited paragraph at the same
 * position reuses its id.
 */
public final class ChunkIdentity {

  /** Length of the derived identifier in hex characters. */
  public static final int ID_LENGTH = 16;

  static final char FIELD_SEPARATOR = '|';
  static final String PATH_SEPARATOR = "\u001F";

  private static final HexFormat HEX = HexFormat.of();

  private ChunkIdentity() {}

  /**
   * Derives the chunk id.
   *
   * @param documentId source document identifier
   * @param sectionPath path of the owning section
   * @param paragraphIndex paragraph index within the section
   * @param subchunkIndex window index for split chunks, {@code null} otherwise
   * @return 16-character lower-case hex string
   */
  public static String deriveId(
      String documentId, List<String> sectionPath, int paragraphIndex, Integer subchunkIndex) {
    String canonical =
        documentId
            + FIELD_SEPARATOR
            + String.join(PATH_SEPARATOR, sectionPath)
            + FIELD_SEPARATOR
            + paragraphIndex
            + FIELD_SEPARATOR
            + (subchunkIndex != null ? subchunkIndex.toString() : "");
    byte[] digest = md5().digest(canonical.getBytes(StandardCharsets.UTF_8));
    return HEX.formatHex(digest).substring(0, ID_LENGTH);
  }

  private static MessageDigest md5() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException e) {
      // every Java platform is required to ship MD5
      throw new IllegalStateException("MD5 digest unavailable", e);
    }
  }
}
