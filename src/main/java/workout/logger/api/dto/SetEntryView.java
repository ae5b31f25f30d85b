package workout.logger.api.dto;

import lombok.Builder;
import lombok.Value;
import workout.logger.api.entity.SetEntry;
import workout.logger.api.security.ResourceIds;

@Value
@Builder
public class SetEntryView {
    String id;
    Double weight;
    Integer reps;

    public static SetEntryView from(SetEntry setEntry) {
        return SetEntryView.builder()
                .id(ResourceIds.format(setEntry.getId()))
                .weight(setEntry.getWeight())
                .reps(setEntry.getReps())
                .build();
    }
}
