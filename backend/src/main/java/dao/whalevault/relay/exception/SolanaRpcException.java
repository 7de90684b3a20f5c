package dao.whalevault.relay.exception;

import lombok.Getter;

@Getter
public class SolanaRpcException extends DomainException {

    /** JSON-RPC error code, 0 when the failure happened before a response. */
    private final int rpcCode;

    public SolanaRpcException(String message) {
        super(message, 502);
        this.rpcCode = 0;
    }

    public SolanaRpcException(String message, int rpcCode) {
        super(message, 502);
        this.rpcCode = rpcCode;
    }

    public SolanaRpcException(String message, Throwable cause) {
        super(message, 502, cause);
        this.rpcCode = 0;
    }
}
