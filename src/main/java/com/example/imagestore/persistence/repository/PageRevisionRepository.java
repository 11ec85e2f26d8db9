package com.example.imagestore.persistence.repository;

import com.example.imagestore.persistence.document.PageRevisionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface PageRevisionRepository extends MongoRepository<PageRevisionDocument, String> {

    long countByHtmlContaining(String fragment);
}
