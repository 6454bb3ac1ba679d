package com.calldash.calldash.data;

import com.calldash.calldash.auth.AuthModels;
import com.calldash.calldash.auth.AuthService;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

/**
 * Upload and lifecycle management of call-log files.
 */
@RestController
@RequestMapping("/api/files")
public class DataFileController {

    private final DataFileService dataFileService;
    private final AuthService authService;

    public DataFileController(DataFileService dataFileService, AuthService authService) {
        this.dataFileService = dataFileService;
        this.authService = authService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DataModels.UploadResponse> upload(@RequestParam("file") MultipartFile file, HttpSession session) {
        AuthModels.AuthUserResponse user = authService.requireCurrentUser(session);
        try {
            return ResponseEntity.ok(dataFileService.upload(file.getOriginalFilename(), file.getBytes(), user.userId()));
        } catch (IllegalArgumentException | TabularParseException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (IOException | DataFileStoreException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to store uploaded file", ex);
        } catch (IngestionException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        }
    }

    @GetMapping
    public ResponseEntity<List<DataFile>> listFiles(HttpSession session) {
        authService.requireCurrentUser(session);
        return ResponseEntity.ok(dataFileService.listFiles());
    }

    /**
     * Soft-deletes a file; {@code deleteFile=true} also removes its stored bytes.
     */
    @DeleteMapping("/{fileId}")
    public ResponseEntity<DataModels.RemoveFileResponse> removeFile(
            @PathVariable long fileId,
            @RequestParam(defaultValue = "false") boolean deleteFile,
            HttpSession session
    ) {
        authService.requireAdmin(authService.requireCurrentUser(session));
        try {
            return ResponseEntity.ok(dataFileService.remove(fileId, deleteFile));
        } catch (DataFileStoreException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        }
    }

    @PostMapping("/{fileId}/restore")
    public ResponseEntity<DataFile> restoreFile(@PathVariable long fileId, HttpSession session) {
        authService.requireAdmin(authService.requireCurrentUser(session));
        return ResponseEntity.ok(dataFileService.restore(fileId));
    }
}
