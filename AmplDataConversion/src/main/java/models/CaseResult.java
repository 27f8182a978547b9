package models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of converting one case file, one row of the summary workbook.
 */
public class CaseResult {

    public enum Status {
        OK,
        MALFORMED,
        IO_ERROR
    }

    private final String caseName;
    private final Status status;
    private final String message;
    private final int setCount;
    private final int paramCount;
    private final int setElementCount;
    private final int skippedLineCount;
    private final Map<String, Object> scalars;
    private final String jsonFile;

    private CaseResult(String caseName, Status status, String message, int setCount, int paramCount,
            int setElementCount, int skippedLineCount, Map<String, Object> scalars, String jsonFile) {
        this.caseName = caseName;
        this.status = status;
        this.message = message;
        this.setCount = setCount;
        this.paramCount = paramCount;
        this.setElementCount = setElementCount;
        this.skippedLineCount = skippedLineCount;
        this.scalars = scalars;
        this.jsonFile = jsonFile;
    }

    public static CaseResult converted(String caseName, AmplDataDocument document, int skippedLineCount,
            String jsonFile) {
        int elements = 0;
        for (List<String> set : document.getSets().values()) {
            elements += set.size();
        }
        Map<String, Object> scalars = new LinkedHashMap<>();
        for (Map.Entry<String, Object> param : document.getParams().entrySet()) {
            if (!(param.getValue() instanceof Map)) {
                scalars.put(param.getKey(), param.getValue());
            }
        }
        return new CaseResult(caseName, Status.OK, "", document.getSets().size(), document.getParams().size(),
                elements, skippedLineCount, Collections.unmodifiableMap(scalars), jsonFile);
    }

    public static CaseResult failed(String caseName, Status status, String message) {
        return new CaseResult(caseName, status, message, 0, 0, 0, 0, Collections.emptyMap(), "");
    }

    public String getCaseName() {
        return caseName;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public String getMessage() {
        return message;
    }

    public int getSetCount() {
        return setCount;
    }

    public int getParamCount() {
        return paramCount;
    }

    public int getSetElementCount() {
        return setElementCount;
    }

    public int getSkippedLineCount() {
        return skippedLineCount;
    }

    /** Scalar params of the case by name, a Double or a String each. */
    public Map<String, Object> getScalars() {
        return scalars;
    }

    public String getJsonFile() {
        return jsonFile;
    }
}
