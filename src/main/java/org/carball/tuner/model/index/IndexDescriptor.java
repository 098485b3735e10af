package org.carball.tuner.model.index;

import lombok.Builder;
import lombok.Data;
import org.carball.tuner.model.query.StoreKind;

import java.util.List;

@Data
@Builder
public class IndexDescriptor {
    private StoreKind store;
    private String owner;
    private String name;
    private List<String> columns;
    private long scanCount;
    private long sizeBytes;
    private boolean unique;
    private boolean primary;
    private long ownerRowCount;

    public boolean isProtected() {
        return unique || primary;
    }
}
