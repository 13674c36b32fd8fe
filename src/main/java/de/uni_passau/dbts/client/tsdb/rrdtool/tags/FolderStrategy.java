package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import de.uni_passau.dbts.client.conf.Constants;
import de.uni_passau.dbts.client.enums.ComparisonOperator;
import de.uni_passau.dbts.client.enums.Connective;
import de.uni_passau.dbts.client.utils.FileUtils;
import de.uni_passau.dbts.client.utils.ValueUtils;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the values of the folder tags as nested directories, in the configured order, and the
 * remaining tags in the file name, e.g., {@code /rrd/us-east/server1/cpu_usage_env-prod.rrd} for
 * the folder tags {@code [region, host]}. A folder tag without value is stored in a directory named
 * {@value Constants#UNSET_FOLDER}. Files without any tag live in the base directory and are not
 * found by searches.
 */
public class FolderStrategy extends AbstractTagStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(FolderStrategy.class);

  private final List<String> folderTags;

  /**
   * Creates the strategy.
   *
   * @param baseDir Directory holding the RRD files, must end with a slash.
   * @param folderTags Tags stored as directories, outermost first.
   * @throws RrdTagException if the directory does not end with a slash.
   */
  public FolderStrategy(String baseDir, List<String> folderTags) throws RrdTagException {
    super(baseDir);
    this.folderTags = Collections.unmodifiableList(new ArrayList<>(folderTags));
  }

  public List<String> getFolderTags() {
    return folderTags;
  }

  @Override
  public String getFilePath(String measurement, Map<String, ?> tags) throws RrdTagException {
    if (tags.isEmpty()) {
      return baseDir + encodeFileName(measurement, tags);
    }
    StringBuilder directory = new StringBuilder(baseDir);
    Map<String, Object> fileTags = new LinkedHashMap<>(tags);
    for (String folderTag : folderTags) {
      Object value = fileTags.remove(folderTag);
      String folder = value == null ? "" : FileUtils.sanitize(scalarValue(folderTag, value));
      directory.append(folder.isEmpty() ? Constants.UNSET_FOLDER : folder).append('/');
    }
    createDirectories(directory.toString());
    return directory + encodeFileName(measurement, fileTags);
  }

  @Override
  public List<String> resolveFilePaths(String measurementPrefix, List<TagCondition> conditions)
      throws RrdTagException {
    String prefix = FileUtils.sanitizeMeasurement(measurementPrefix);
    List<String> paths = new ArrayList<>();
    for (Candidate candidate : candidates(conditions)) {
      if (candidate.measurement.startsWith(prefix)
          && TagSearch.search(candidate.tags, conditions)) {
        paths.add(candidate.path);
      }
    }
    Collections.sort(paths);
    LOGGER.debug("Resolved {} files for {} and {}", paths.size(), measurementPrefix, conditions);
    return paths;
  }

  @Override
  public List<String> findMeasurementsByTags(List<TagCondition> conditions)
      throws RrdTagException {
    TreeSet<String> measurements = new TreeSet<>();
    for (Candidate candidate : candidates(conditions)) {
      if (TagSearch.search(candidate.tags, conditions)) {
        measurements.add(candidate.measurement);
      }
    }
    return new ArrayList<>(measurements);
  }

  /**
   * Collects the files at folder depth. When every condition is joined by AND, equality conditions
   * on folder tags restrict the directories that are visited.
   */
  private List<Candidate> candidates(List<TagCondition> conditions) throws RrdTagException {
    Map<String, String> pinned = pinnedFolders(conditions);
    List<Candidate> candidates = new ArrayList<>();
    collect(baseDir, 0, new LinkedHashMap<>(), pinned, candidates);
    return candidates;
  }

  private void collect(
      String directory,
      int depth,
      Map<String, String> folderValues,
      Map<String, String> pinned,
      List<Candidate> candidates)
      throws RrdTagException {
    if (depth == folderTags.size()) {
      for (String fileName : listRrdFiles(Paths.get(directory))) {
        DecodedFileName decoded = decodeFileName(fileName);
        if (decoded == null) {
          continue;
        }
        Map<String, String> tags = new HashMap<>(decoded.getTags());
        tags.putAll(folderValues);
        candidates.add(new Candidate(directory + fileName, decoded.getMeasurement(), tags));
      }
      return;
    }
    String folderTag = folderTags.get(depth);
    String wanted = pinned.get(folderTag);
    for (String folder : listDirectories(Paths.get(directory))) {
      if (wanted != null && !FileUtils.sanitizeTagValue(folder).equals(wanted)) {
        continue;
      }
      Map<String, String> values = new LinkedHashMap<>(folderValues);
      if (!Constants.UNSET_FOLDER.equals(folder)) {
        values.put(folderTag, folder);
      }
      collect(directory + folder + "/", depth + 1, values, pinned, candidates);
    }
  }

  private Map<String, String> pinnedFolders(List<TagCondition> conditions) {
    Map<String, String> pinned = new HashMap<>();
    for (int i = 1; i < conditions.size(); i++) {
      if (conditions.get(i).getConnective() == Connective.OR) {
        return pinned;
      }
    }
    for (TagCondition condition : conditions) {
      ComparisonOperator operator = condition.getOperator();
      if ((operator == ComparisonOperator.EQUALS || operator == ComparisonOperator.SAME)
          && folderTags.contains(condition.getTag())
          && !(condition.getValue() instanceof List)) {
        String folder = FileUtils.sanitize(ValueUtils.stringValue(condition.getValue()));
        // Empty values live in the unset folder, which the pinned comparison cannot express.
        if (!folder.isEmpty()) {
          pinned.put(condition.getTag(), FileUtils.sanitizeTagValue(folder));
        }
      }
    }
    return pinned;
  }

  /** A file found below the folder directories. */
  private static class Candidate {
    private final String path;
    private final String measurement;
    private final Map<String, String> tags;

    Candidate(String path, String measurement, Map<String, String> tags) {
      this.path = path;
      this.measurement = measurement;
      this.tags = tags;
    }
  }
}
