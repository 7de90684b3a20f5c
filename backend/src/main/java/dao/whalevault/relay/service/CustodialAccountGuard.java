package dao.whalevault.relay.service;

import com.google.common.util.concurrent.Striped;
import org.p2p.solanaj.core.PublicKey;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialises read-balance-then-submit sections per custodial account inside this process.
 * Callers that need two guards take the token account first, then the SOL account.
 * Accounts share a fixed set of lock stripes, so unrelated accounts may occasionally wait on each other.
 */
@Component
public class CustodialAccountGuard {

    static final int STRIPES = 64;

    private final Striped<Lock> locks = Striped.lazyWeakLock(STRIPES);

    public <T> T withAccount(PublicKey account, Supplier<T> section) {
        Lock lock = locks.get(account);
        lock.lock();
        try {
            return section.get();
        } finally {
            lock.unlock();
        }
    }

    int stripes() {
        return locks.size();
    }

    boolean isHeld(PublicKey account) {
        Lock lock = locks.get(account);
        return lock instanceof ReentrantLock && ((ReentrantLock) lock).isLocked();
    }
}
