package personal.ai.dialog.card.domain.model;

import java.util.List;

public record ListSection(String title, List<ListRow> rows) {
    public ListSection {
        rows = List.copyOf(rows);
    }
}
