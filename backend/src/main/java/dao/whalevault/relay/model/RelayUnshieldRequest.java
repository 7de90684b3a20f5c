package dao.whalevault.relay.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelayUnshieldRequest {

    @NotBlank
    private String jobId;

    @NotBlank
    private String recipient;       // base58
}
