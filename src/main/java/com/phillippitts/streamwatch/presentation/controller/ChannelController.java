package com.phillippitts.streamwatch.presentation.controller;

import com.phillippitts.streamwatch.domain.ChannelPatch;
import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.service.channel.ChannelService;
import com.phillippitts.streamwatch.service.channel.ChannelView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Channel commands and read-only status views over JSON.
 */
@RestController
@RequestMapping("/api/channels")
class ChannelController {

    private static final Logger LOG = LogManager.getLogger(ChannelController.class);

    private final ChannelService channelService;

    ChannelController(ChannelService channelService) {
        this.channelService = channelService;
    }

    @GetMapping
    List<ChannelView> list() {
        return channelService.views();
    }

    @GetMapping("/{id}")
    ChannelView get(@PathVariable String id) {
        return channelService.view(id);
    }

    @PostMapping
    ResponseEntity<ChannelView> add(@Valid @RequestBody AddChannelRequest request) {
        ChannelPatch patch = request.config() == null ? null : ChannelPatch.fromMap(request.config());
        ChannelState channel = channelService.addChannel(request.url(), request.displayName(), patch);
        return ResponseEntity.status(HttpStatus.CREATED).body(channelService.view(channel.getId()));
    }

    @PatchMapping("/{id}")
    ChannelView update(@PathVariable String id, @RequestBody Map<String, Object> changes) {
        channelService.updateChannel(id, ChannelPatch.fromMap(changes));
        return channelService.view(id);
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> remove(@PathVariable String id) {
        int removed = channelService.removeChannels(List.of(id));
        return removed > 0 ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/remove")
    Map<String, Integer> removeMany(@Valid @RequestBody IdsRequest request) {
        return Map.of("removed", channelService.removeChannels(request.ids()));
    }

    @PostMapping("/{id}/start")
    ChannelView start(@PathVariable String id) {
        channelService.startMonitoring(id);
        return channelService.view(id);
    }

    @PostMapping("/{id}/stop")
    ChannelView stop(@PathVariable String id) {
        channelService.stopMonitoring(id);
        return channelService.view(id);
    }

    @PostMapping("/{id}/stop-recording")
    ChannelView stopRecording(@PathVariable String id) {
        boolean stopped = channelService.stopRecording(id);
        LOG.info("Stop recording requested for {}: {}", id, stopped ? "stopped" : "no session open");
        return channelService.view(id);
    }

    @PostMapping("/start")
    Map<String, Integer> startMany(@Valid @RequestBody IdsRequest request) {
        return Map.of("started", channelService.startMonitoring(request.ids()).size());
    }

    @PostMapping("/stop")
    Map<String, Integer> stopMany(@Valid @RequestBody IdsRequest request) {
        return Map.of("stopped", channelService.stopMonitoring(request.ids()).size());
    }

    @PostMapping("/start-all")
    Map<String, Integer> startAll() {
        return Map.of("started", channelService.startAll().size());
    }

    @PostMapping("/stop-all")
    Map<String, Integer> stopAll() {
        return Map.of("stopped", channelService.stopAll().size());
    }

    record AddChannelRequest(@NotBlank String url, String displayName, Map<String, Object> config) {
    }

    record IdsRequest(@NotEmpty List<String> ids) {
    }
}
