package com.visualoom.controller;

import com.visualoom.exception.CatalogPersistenceException;
import com.visualoom.model.ImageRecord;
import com.visualoom.service.ImageService;
import com.visualoom.service.TagService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ImageController.class)
class ImageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ImageService imageService;

    @MockBean
    private TagService tagService;

    @Test
    void listImages() throws Exception {
        ImageRecord record = new ImageRecord();
        record.setId("img-1");
        record.setPath("/photos/a.jpg");
        when(imageService.listImages()).thenReturn(List.of(record));
        when(tagService.tagNamesById()).thenReturn(Map.of());

        mockMvc.perform(get("/api/images"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.images[0].path").value("/photos/a.jpg"))
                .andExpect(jsonPath("$.images[0].embedded").value(false));
    }

    @Test
    void addImageByPath() throws Exception {
        ImageRecord record = new ImageRecord();
        record.setId("img-9");
        record.setPath("/photos/new.png");
        when(imageService.addImage(Paths.get("/photos/new.png"))).thenReturn(Optional.of(record));
        when(tagService.tagNamesById()).thenReturn(Map.of());

        mockMvc.perform(post("/api/images")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \" /photos/new.png \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.image.id").value("img-9"))
                .andExpect(jsonPath("$.image.fileName").value("new.png"));
    }

    @Test
    void addUnreadableImageIsUnprocessable() throws Exception {
        when(imageService.addImage(Paths.get("/photos/broken.jpg"))).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/images")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"/photos/broken.jpg\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void addUnsupportedFileIsBadRequest() throws Exception {
        when(imageService.addImage(Paths.get("/photos/notes.txt")))
                .thenThrow(new IllegalArgumentException("Not a supported image file: /photos/notes.txt"));

        mockMvc.perform(post("/api/images")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"/photos/notes.txt\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void addImageWithoutPathIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/images")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void deleteImage() throws Exception {
        when(imageService.deleteImage("img-1")).thenReturn(true);

        mockMvc.perform(delete("/api/images/img-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deleted"));
    }

    @Test
    void deleteUnknownImageIsNotFound() throws Exception {
        when(imageService.deleteImage("nope")).thenReturn(false);

        mockMvc.perform(delete("/api/images/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void failedCatalogWriteIsServerError() throws Exception {
        when(imageService.deleteImage("img-1")).thenThrow(new CatalogPersistenceException("Failed to write catalog"));

        mockMvc.perform(delete("/api/images/img-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Failed to write catalog"));
    }

    @Test
    void listFolders() throws Exception {
        when(imageService.getIndexedFolders()).thenReturn(List.of("/photos"));

        mockMvc.perform(get("/api/folders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.folders[0]").value("/photos"));
    }
}
