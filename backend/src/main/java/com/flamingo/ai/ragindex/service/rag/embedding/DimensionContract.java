package com.flamingo.ai.ragindex.service.rag.embedding;

import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.exception.DimensionMismatchException;
import com.flamingo.ai.ragindex.exception.InvalidQueryException;
import com.flamingo.ai.ragindex.vectorstore.VectorRecord;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Checks vectors against the service-wide embedding dimension. */
@Component
@RequiredArgsConstructor
public class DimensionContract {

  private final RagConfig ragConfig;

  /** The configured embedding dimension. */
  public int dimension() {
    return ragConfig.getEmbedding().getDimension();
  }

  /**
   * Fails unless {@code vector} has exactly {@link #dimension()} components.
   *
   * @param vector the vector, null counts as empty
   * @param subject what the vector belongs to, used in the error message
   * @throws DimensionMismatchException on a length mismatch
   */
  public void requireDimension(List<Float> vector, String subject) {
    int actual = vector == null ? 0 : vector.size();
    if (actual != dimension()) {
      throw new DimensionMismatchException(dimension(), actual, subject);
    }
  }

  /**
   * Checks a caller-supplied vector: the length first, then every component.
   *
   * @param vector the vector, null counts as empty
   * @param subject what the vector belongs to, used in the error messages
   * @throws DimensionMismatchException on a length mismatch
   * @throws InvalidQueryException if a component is null, NaN or infinite
   */
  public void requireValidVector(List<Float> vector, String subject) {
    requireDimension(vector, subject);
    int index = firstInvalidComponent(vector);
    if (index >= 0) {
      throw new InvalidQueryException(
          subject + " has a null or non-finite component at index " + index);
    }
  }

  /**
   * Checks every record before any of them is written.
   *
   * @param records records about to be upserted
   * @throws DimensionMismatchException for the first record with a wrong length
   * @throws InvalidQueryException for the first record with a null or non-finite component
   */
  public void requireDimensions(Collection<VectorRecord> records) {
    for (VectorRecord record : records) {
      requireValidVector(record.values(), "record " + record.id());
    }
  }

  /** Index of the first null, NaN or infinite component, or -1 when there is none. */
  public static int firstInvalidComponent(List<Float> vector) {
    for (int i = 0; i < vector.size(); i++) {
      Float component = vector.get(i);
      if (component == null || !Float.isFinite(component)) {
        return i;
      }
    }
    return -1;
  }
}
