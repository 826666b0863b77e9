package io.streambatch;

/** Raised by a {@link io.streambatch.source.BatchSource} when the dataset does not exist. */
public class DatasetNotFoundException extends NotFoundException {
  private final String dataset;

  public DatasetNotFoundException(String dataset, String location) {
    super("Dataset not found: " + dataset + " (" + location + ")");
    this.dataset = dataset;
  }

  /** Returns the dataset identifier that could not be resolved. */
  public String dataset() {
    return dataset;
  }
}
