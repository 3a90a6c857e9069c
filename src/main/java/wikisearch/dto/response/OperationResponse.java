package wikisearch.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResponse {
    private final boolean result;
    private final String error;

    public OperationResponse(boolean result) {
        this.result = result;
        this.error = null;
    }
}
