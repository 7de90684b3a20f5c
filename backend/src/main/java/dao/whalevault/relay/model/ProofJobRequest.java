package dao.whalevault.relay.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class ProofJobRequest {

    @NotBlank
    private String commitment;      // hex

    @NotBlank
    private String secret;          // hex

    @NotNull
    @Positive
    private Long amount;            // lamports

    @NotBlank
    private String recipient;       // base58

    @PositiveOrZero
    private Long denomination = 0L; // 0 = variable-amount pool
}
