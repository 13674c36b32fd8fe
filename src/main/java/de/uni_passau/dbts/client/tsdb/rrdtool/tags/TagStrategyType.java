package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import java.util.List;

/** Available ways of storing tags of RRD files. */
public enum TagStrategyType {
  FILENAME,
  FOLDER,
  NONE;

  /**
   * Creates a strategy of this type.
   *
   * @param baseDir Directory holding the RRD files, must end with a slash.
   * @param folderTags Tags stored as directories, only used by {@link #FOLDER}.
   * @return Strategy.
   * @throws RrdTagException if the directory does not end with a slash.
   */
  public TagStrategy create(String baseDir, List<String> folderTags) throws RrdTagException {
    switch (this) {
      case FILENAME:
        return new FileNameStrategy(baseDir);
      case FOLDER:
        return new FolderStrategy(baseDir, folderTags);
      case NONE:
        return new NoTagsStrategy(baseDir);
      default:
        throw new IllegalStateException("Unknown tag strategy " + this);
    }
  }

  /**
   * Parses a strategy name, case insensitive.
   *
   * @param name Strategy name, e.g., {@code folder}.
   * @return Strategy type.
   * @throws IllegalArgumentException if the name is unknown.
   */
  public static TagStrategyType parse(String name) {
    for (TagStrategyType type : values()) {
      if (type.name().equalsIgnoreCase(name.trim())) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported tag strategy " + name);
  }
}
