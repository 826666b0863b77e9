package io.streambatch.source;

import io.streambatch.FormatUnsupportedException;
import io.streambatch.config.DelimitedTextOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Dataset formats understood by the built-in sources, selected by file extension. */
public enum DataFormat {
  /** Arrow IPC file; each record batch is one row group. */
  ARROW_IPC(List.of(".arrow", ".feather", ".ipc")),
  /** Parquet file; each row group is one input batch and only requested column chunks are read. */
  PARQUET(List.of(".parquet")),
  /** Comma separated text with a header row. */
  CSV(List.of(".csv", ".dat")),
  /** Pipe separated text without header, one trailing delimiter per line. */
  TBL(List.of(".tbl"));

  /** Extensions tried, in order, for a dataset name that has none. */
  public static final List<String> BARE_NAME_EXTENSIONS = List.of(".parquet", ".arrow");

  private final List<String> extensions;

  DataFormat(List<String> extensions) {
    this.extensions = extensions;
  }

  /** Returns the file extensions including dot (e.g., ".arrow"). */
  public List<String> extensions() {
    return extensions;
  }

  /** Whether this is a delimited text format. */
  public boolean isText() {
    return this == CSV || this == TBL;
  }

  /** Default parsing options of a text format. */
  public DelimitedTextOptions defaultTextOptions() {
    switch (this) {
      case CSV:
        return DelimitedTextOptions.csv();
      case TBL:
        return DelimitedTextOptions.tbl();
      default:
        throw new IllegalStateException(this + " is not a text format");
    }
  }

  /**
   * Names a dataset may be stored under. A name whose last path segment has an extension is used
   * as is; otherwise each of {@link #BARE_NAME_EXTENSIONS} is appended in turn.
   */
  public static List<String> candidateNames(String dataset) {
    int slash = Math.max(dataset.lastIndexOf('/'), dataset.lastIndexOf('\\'));
    String last = dataset.substring(slash + 1);
    if (last.indexOf('.') >= 0) {
      return List.of(dataset);
    }
    List<String> names = new ArrayList<>(BARE_NAME_EXTENSIONS.size());
    for (String extension : BARE_NAME_EXTENSIONS) {
      names.add(dataset + extension);
    }
    return names;
  }

  /**
   * Detects the format from the dataset name's extension, case-insensitively.
   *
   * @throws FormatUnsupportedException if no format claims the extension
   */
  public static DataFormat detect(String dataset) {
    String lower = dataset.toLowerCase(Locale.ROOT);
    for (DataFormat format : values()) {
      for (String extension : format.extensions) {
        if (lower.endsWith(extension)) {
          return format;
        }
      }
    }
    throw new FormatUnsupportedException(
        "Unsupported format for " + dataset + "; expected one of .arrow, .feather, .ipc, "
            + ".parquet, .csv, .dat or .tbl");
  }
}
