package com.linlay.carassist.tool;

import com.linlay.carassist.storage.StorageException;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractStorageTool implements BaseTool {

    private static final Logger log = LoggerFactory.getLogger(AbstractStorageTool.class);

    protected final StorageGateway storageGateway;

    protected AbstractStorageTool(StorageGateway storageGateway) {
        this.storageGateway = storageGateway;
    }

    @Override
    public final ToolResult invoke(ToolInvocation invocation) {
        ToolResult rejected = precheck(invocation);
        if (rejected != null) {
            return rejected;
        }
        try {
            return storageGateway.execute(
                    invocation.session().storageDescriptor(),
                    storage -> run(storage, invocation)
            );
        } catch (StorageException ex) {
            log.warn("[{}] {} storage failure category={} detail={}",
                    invocation.session().shortId(), name().wireName(), ex.category(), ex.getMessage());
            return StorageResults.fromFailure(ex, actionLabel());
        }
    }

    protected ToolResult precheck(ToolInvocation invocation) {
        return null;
    }

    protected abstract ToolResult run(StorageSession storage, ToolInvocation invocation);

    protected String actionLabel() {
        return "Lookup";
    }

    protected static long nextTemporaryId(StorageSession storage, Table table) {
        Long min = storage.minId(table);
        return min == null || min > 0 ? -1L : min - 1;
    }
}
