package com.example.imagestore.persistence.repository;

import com.example.imagestore.model.ImageType;
import com.example.imagestore.persistence.document.ImageDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface ImageRepository extends MongoRepository<ImageDocument, String> {

    List<ImageDocument> findByTypeInOrderByIdAsc(Collection<ImageType> types, Pageable pageable);

    List<ImageDocument> findByTypeInAndIdGreaterThanOrderByIdAsc(Collection<ImageType> types, String id, Pageable pageable);
}
