package io.formulaflow.core.analysis;

import io.formulaflow.core.error.OperandTypeException;
import io.formulaflow.core.model.Value;
import java.util.List;
import java.util.Map;

/** Builds a column vector out of per-row values. */
public final class ColumnVectors {

    private ColumnVectors() {
        // utility class
    }

    /**
     * Collects {@code column} from every row, in row order. Rows lacking the column, or holding
     * {@code NULL}, contribute NaN. Booleans become 1/0.
     *
     * @param formula the formula the vector is assembled for, used in error messages; may be null
     * @throws OperandTypeException if an entry is a string or a vector
     */
    public static Value.Vector assemble(String column, List<Map<String, Value>> rows, String formula) {
        double[] out = new double[rows.size()];
        for (int i = 0; i < out.length; i++) {
            Value v = rows.get(i).get(column);
            if (v == null || v.isNull()) {
                out[i] = Double.NaN;
            } else if (v instanceof Value.Num n) {
                out[i] = n.value();
            } else if (v instanceof Value.Bool b) {
                out[i] = b.value() ? 1.0 : 0.0;
            } else {
                throw new OperandTypeException(
                        String.format(
                                "column '%s' must be numeric to form a vector, row %d holds %s",
                                column, i, v.kind()),
                        formula,
                        i);
            }
        }
        return Value.vector(out);
    }
}
