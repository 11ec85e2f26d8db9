package com.example.imagestore.persistence.repository;

import com.example.imagestore.persistence.document.PageDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface PageRepository extends MongoRepository<PageDocument, String> {

    long countByHtmlContaining(String fragment);
}
