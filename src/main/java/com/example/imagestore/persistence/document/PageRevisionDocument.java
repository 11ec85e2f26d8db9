package com.example.imagestore.persistence.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "page_revisions")
public class PageRevisionDocument {

    @Id
    private String id;

    @Indexed
    private String pageId;

    private String html;
    private Instant createdAt;
}
