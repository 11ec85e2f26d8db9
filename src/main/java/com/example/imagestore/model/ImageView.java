package com.example.imagestore.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ImageView {

    String id;
    String name;
    String path;
    String url;
    ImageType type;
    String uploadedTo;
    String createdBy;
    long createdAt;
}
