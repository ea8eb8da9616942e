package com.softpower.backend.events.dto;

import com.softpower.backend.events.entity.DailyEventMention;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionDto {
    private UUID id;
    private UUID canonicalEventId;
    private String country;
    private LocalDate mentionDate;
    private Integer articleCount;
    private String consolidatedHeadline;
    private List<String> sourceNames;
    private List<String> docIds;

    public static MentionDto from(DailyEventMention mention) {
        return MentionDto.builder()
                .id(mention.getId())
                .canonicalEventId(mention.getCanonicalEvent().getId())
                .country(mention.getCountry())
                .mentionDate(mention.getMentionDate())
                .articleCount(mention.getArticleCount())
                .consolidatedHeadline(mention.getConsolidatedHeadline())
                .sourceNames(List.copyOf(mention.getSourceNames()))
                .docIds(mention.getDocIds().stream().sorted().toList())
                .build();
    }
}
