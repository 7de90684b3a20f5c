package dao.whalevault.relay.exception;

import lombok.Getter;

@Getter
public class RelayerException extends DomainException {

    public enum Kind {
        DISABLED(503),
        INVALID_INPUT(400),
        CHAIN_REJECTED(502);

        private final int status;

        Kind(int status) {
            this.status = status;
        }
    }

    private final Kind kind;

    public RelayerException(Kind kind, String message) {
        super(message, kind.status);
        this.kind = kind;
    }

    public RelayerException(Kind kind, String message, Throwable cause) {
        super(message, kind.status, cause);
        this.kind = kind;
    }
}
