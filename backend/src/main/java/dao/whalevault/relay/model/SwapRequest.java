package dao.whalevault.relay.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SwapRequest {

    @NotBlank
    private String jobId;

    @NotBlank
    private String outputMint;

    @NotBlank
    private String recipient;

    /** jupiter or raydium; empty selects the configured default. */
    private String provider;
}
