package com.example.imagestore.persistence.document;

import com.example.imagestore.model.ImageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A stored source image. {@code uploadedTo} is {@code null} while the image is not attached to any page,
 * and {@code createdBy}/{@code updatedBy} are {@code null} for uploads made by the system itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "images")
public class ImageDocument {

    @Id
    private String id;

    private String name;

    @Indexed(unique = true)
    private String path;

    private String url;

    @Indexed
    private ImageType type;

    @Indexed
    private String uploadedTo;

    private String createdBy;
    private String updatedBy;
    private Instant createdAt;
    private Instant updatedAt;
}
