package com.project.image.bgremover.controller;

import com.project.image.bgremover.service.BackgroundRemovalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the HTML pages. Thin controller: just routes to Thymeleaf views.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final BackgroundRemovalService backgroundRemovalService;

    public HomeController(BackgroundRemovalService backgroundRemovalService) {
        this.backgroundRemovalService = backgroundRemovalService;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        model.addAttribute("modelReady", backgroundRemovalService.isModelReady());
        return "index"; // templates/index.html
    }

    @GetMapping("/gallery")
    public String gallery() {
        return "gallery";
    }
}
