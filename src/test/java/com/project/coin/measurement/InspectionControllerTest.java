package com.project.coin.measurement;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "measure.segmenter=java")
@AutoConfigureMockMvc
class InspectionControllerTest {

    static final Path INPUT_DIR = createInputDir();

    @DynamicPropertySource
    static void inputDir(DynamicPropertyRegistry registry) {
        registry.add("measure.input-dir", INPUT_DIR::toString);
    }

    @Autowired MockMvc mvc;

    private static Path createInputDir() {
        try {
            Path dir = Files.createTempDirectory("coins-web");
            TestImages.writePng(TestImages.twoCoins(), dir.resolve("a_coins.png"));
            Files.write(dir.resolve("b_broken.png"), "garbage".getBytes());
            TestImages.writePng(TestImages.ringWithInnerDisk(), dir.resolve("c_ring.png"));
            return dir;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void home_listsImages() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(model().attribute("images", contains("a_coins.png", "b_broken.png", "c_ring.png")))
                .andExpect(model().attribute("scale", "none"));
    }

    @Test
    void inspect_measuresImage_andSelectsByClick() throws Exception {
        MockHttpSession session = new MockHttpSession();

        mvc.perform(get("/inspect/a_coins.png").session(session))
                .andExpect(status().isOk())
                .andExpect(view().name("inspect"))
                .andExpect(model().attribute("objectCount", 2))
                .andExpect(model().attribute("hasNext", true))
                .andExpect(content().string(containsString("detected")));

        mvc.perform(get("/inspect/select").param("click.x", "105").param("click.y", "98").session(session))
                .andExpect(status().isOk())
                .andExpect(model().attribute("message", startsWith("Object 1: ")))
                .andExpect(model().attribute("selectedId", 1));

        mvc.perform(get("/inspect/select").param("click.x", "5").param("click.y", "5").session(session))
                .andExpect(status().isOk())
                .andExpect(model().attribute("message", "No object at (5, 5)"))
                .andExpect(model().attribute("selectedId", 1));

        mvc.perform(get("/inspect/image.png").session(session))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"));
    }

    @Test
    void image_withoutCurrentImage_isNotFound() throws Exception {
        mvc.perform(get("/inspect/image.png").session(new MockHttpSession()))
                .andExpect(status().isNotFound());
    }

    @Test
    void select_withoutCurrentImage_redirectsHome() throws Exception {
        mvc.perform(get("/inspect/select").param("click.x", "1").param("click.y", "1").session(new MockHttpSession()))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/"));
    }

    @Test
    void inspect_unreadableImage_isReportedAndSkipped() throws Exception {
        mvc.perform(get("/inspect/b_broken.png"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/"))
                .andExpect(flash().attribute("error", containsString("b_broken.png")));
    }

    @Test
    void inspect_unknownImage_isReported() throws Exception {
        mvc.perform(get("/inspect/missing.png"))
                .andExpect(status().is3xxRedirection())
                .andExpect(flash().attribute("error", containsString("missing.png")));
    }

    @Test
    void next_advancesInNameOrder_andEndsAtHome() throws Exception {
        MockHttpSession session = new MockHttpSession();
        mvc.perform(get("/inspect/a_coins.png").session(session)).andExpect(status().isOk());

        mvc.perform(get("/inspect/next").session(session))
                .andExpect(redirectedUrl("/inspect/b_broken.png"));

        mvc.perform(get("/inspect/c_ring.png").session(session))
                .andExpect(model().attribute("objectCount", 1))
                .andExpect(model().attribute("hasNext", false));

        mvc.perform(get("/inspect/next").session(session))
                .andExpect(redirectedUrl("/"));
    }

    @Test
    void upload_measuresInMemory_withScaleOverride() throws Exception {
        MockMultipartFile img = new MockMultipartFile(
                "file", "upload.png", "image/png", TestImages.png(TestImages.twoCoins()));

        mvc.perform(multipart("/inspect/upload").file(img).param("scale", "0.1"))
                .andExpect(status().isOk())
                .andExpect(view().name("inspect"))
                .andExpect(model().attribute("objectCount", 2))
                .andExpect(model().attribute("scale", 0.1))
                .andExpect(content().string(containsString("Diameter (mm)")));
    }

    @Test
    void upload_withoutScale_hasNoPhysicalSizes() throws Exception {
        MockMultipartFile img = new MockMultipartFile(
                "file", "upload.png", "image/png", TestImages.png(TestImages.twoCoins()));

        mvc.perform(multipart("/inspect/upload").file(img))
                .andExpect(status().isOk())
                .andExpect(model().attribute("scale", nullValue()))
                .andExpect(content().string(not(containsString("Diameter (mm)"))));
    }

    @Test
    void upload_nonImage_isRejected() throws Exception {
        MockMultipartFile notImage = new MockMultipartFile("file", "x.txt", "text/plain", "hi".getBytes());

        mvc.perform(multipart("/inspect/upload").file(notImage))
                .andExpect(status().is3xxRedirection())
                .andExpect(flash().attribute("error", containsString("Unsupported file type")));
    }

    @Test
    void upload_corruptImage_isRejected() throws Exception {
        MockMultipartFile corrupt = new MockMultipartFile("file", "x.png", "image/png", new byte[]{1, 2, 3});

        mvc.perform(multipart("/inspect/upload").file(corrupt))
                .andExpect(status().is3xxRedirection())
                .andExpect(flash().attribute("error", containsString("not a valid image")));
    }
}
