package com.example.imagestore.storage;

import com.example.imagestore.exception.ImageNotFoundException;
import com.example.imagestore.exception.ImageStorageException;
import io.minio.CopyObjectArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.Directive;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectsArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.DeleteError;
import io.minio.messages.ErrorResponse;
import io.minio.messages.Item;
import okhttp3.Headers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MinioImageStorageTest {

    private static final String BUCKET = "images";

    @Mock
    private MinioClient minioClient;

    private MinioImageStorage storage;

    @BeforeEach
    void setUp() {
        storage = new MinioImageStorage(minioClient, BUCKET);
    }

    @Test
    void exists_statOk_returnsTrue() throws Exception {
        when(minioClient.statObject(any(StatObjectArgs.class))).thenReturn(null);

        assertTrue(storage.exists("uploads/images/gallery/a.png"));
    }

    @Test
    void exists_noSuchKey_returnsFalse() throws Exception {
        doThrow(errorResponse("NoSuchKey")).when(minioClient).statObject(any(StatObjectArgs.class));

        assertFalse(storage.exists("uploads/images/gallery/a.png"));
    }

    @Test
    void exists_otherError_throwsStorageException() throws Exception {
        doThrow(errorResponse("AccessDenied")).when(minioClient).statObject(any(StatObjectArgs.class));

        assertThrows(ImageStorageException.class, () -> storage.exists("uploads/images/gallery/a.png"));
    }

    @Test
    void get_returnsObjectBytes() throws Exception {
        byte[] content = "png-bytes".getBytes(StandardCharsets.UTF_8);
        GetObjectResponse response = new GetObjectResponse(
            Headers.of(Map.of()), BUCKET, "", "uploads/images/gallery/a.png", new ByteArrayInputStream(content));
        when(minioClient.getObject(any(GetObjectArgs.class))).thenReturn(response);

        assertArrayEquals(content, storage.get("/uploads/images/gallery/a.png"));

        ArgumentCaptor<GetObjectArgs> captor = ArgumentCaptor.forClass(GetObjectArgs.class);
        verify(minioClient).getObject(captor.capture());
        assertEquals(BUCKET, captor.getValue().bucket());
        assertEquals("uploads/images/gallery/a.png", captor.getValue().object());
    }

    @Test
    void get_noSuchKey_throwsNotFound() throws Exception {
        doThrow(errorResponse("NoSuchKey")).when(minioClient).getObject(any(GetObjectArgs.class));

        assertThrows(ImageNotFoundException.class, () -> storage.get("uploads/images/gallery/a.png"));
    }

    @Test
    void put_uploadsWholeObject() throws Exception {
        byte[] content = "png-bytes".getBytes(StandardCharsets.UTF_8);

        storage.put("uploads/images/gallery/a.png", content);

        ArgumentCaptor<PutObjectArgs> captor = ArgumentCaptor.forClass(PutObjectArgs.class);
        verify(minioClient).putObject(captor.capture());
        assertEquals("uploads/images/gallery/a.png", captor.getValue().object());
        assertEquals(content.length, captor.getValue().objectSize());
    }

    @Test
    void put_failure_throwsStorageException() throws Exception {
        doThrow(new RuntimeException("connection reset")).when(minioClient).putObject(any(PutObjectArgs.class));

        assertThrows(ImageStorageException.class, () -> storage.put("uploads/images/gallery/a.png", new byte[]{1}));
    }

    @Test
    void setPublic_copiesObjectOntoItself() throws Exception {
        storage.setPublic("uploads/images/gallery/a.png");

        ArgumentCaptor<CopyObjectArgs> captor = ArgumentCaptor.forClass(CopyObjectArgs.class);
        verify(minioClient).copyObject(captor.capture());
        CopyObjectArgs args = captor.getValue();
        assertEquals("uploads/images/gallery/a.png", args.object());
        assertEquals("uploads/images/gallery/a.png", args.source().object());
        assertEquals(Directive.REPLACE, args.metadataDirective());
    }

    @Test
    void deleteMany_emptyList_skipsRequest() {
        storage.delete(List.of());

        verifyNoInteractions(minioClient);
    }

    @Test
    void deleteMany_reportsFailedObjects() throws Exception {
        DeleteError error = mock(DeleteError.class);
        when(error.objectName()).thenReturn("uploads/images/gallery/a.png");
        when(error.message()).thenReturn("Access Denied");
        when(minioClient.removeObjects(any(RemoveObjectsArgs.class))).thenReturn(List.of(new Result<>(error)));

        ImageStorageException ex = assertThrows(ImageStorageException.class,
            () -> storage.delete(List.of("uploads/images/gallery/a.png", "uploads/images/gallery/b.png")));

        assertTrue(ex.getMessage().contains("uploads/images/gallery/a.png"));
    }

    @Test
    void deleteMany_allRemoved_completes() {
        when(minioClient.removeObjects(any(RemoveObjectsArgs.class))).thenReturn(List.of());

        storage.delete(List.of("uploads/images/gallery/a.png"));

        verify(minioClient).removeObjects(any(RemoveObjectsArgs.class));
    }

    @Test
    void directories_listsPrefixesOnly() {
        Item file = item("d/a.png", false);
        Item directory = item("d/thumbs-1-1/", true);
        when(minioClient.listObjects(any(ListObjectsArgs.class))).thenReturn(List.of(
            new Result<>(file),
            new Result<>(directory)
        ));

        assertEquals(List.of("d/thumbs-1-1"), storage.directories("d/"));

        ArgumentCaptor<ListObjectsArgs> captor = ArgumentCaptor.forClass(ListObjectsArgs.class);
        verify(minioClient).listObjects(captor.capture());
        assertEquals("d/", captor.getValue().prefix());
        assertFalse(captor.getValue().recursive());
    }

    @Test
    void allFiles_listsRecursively() {
        Item top = item("d/a.png", false);
        Item nested = item("d/thumbs-1-1/a.png", false);
        when(minioClient.listObjects(any(ListObjectsArgs.class))).thenReturn(List.of(
            new Result<>(top),
            new Result<>(nested)
        ));

        assertEquals(List.of("d/a.png", "d/thumbs-1-1/a.png"), storage.allFiles("d"));

        ArgumentCaptor<ListObjectsArgs> captor = ArgumentCaptor.forClass(ListObjectsArgs.class);
        verify(minioClient).listObjects(captor.capture());
        assertTrue(captor.getValue().recursive());
    }

    private static ErrorResponseException errorResponse(String code) {
        ErrorResponse response = mock(ErrorResponse.class);
        when(response.code()).thenReturn(code);
        ErrorResponseException ex = mock(ErrorResponseException.class);
        when(ex.errorResponse()).thenReturn(response);
        return ex;
    }

    private static Item item(String name, boolean dir) {
        Item item = mock(Item.class);
        lenient().when(item.objectName()).thenReturn(name);
        lenient().when(item.isDir()).thenReturn(dir);
        return item;
    }
}
