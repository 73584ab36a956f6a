package io.github.drompincen.startpage.gateway.controller;

import io.github.drompincen.startpage.protocol.api.LinkStatusDto;
import io.github.drompincen.startpage.runtime.status.LinkStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

    private final LinkStatusService statusService;

    public StatusController(LinkStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/api/check_status")
    public LinkStatusDto check(@RequestParam(required = false) String url) {
        return statusService.check(url);
    }
}
