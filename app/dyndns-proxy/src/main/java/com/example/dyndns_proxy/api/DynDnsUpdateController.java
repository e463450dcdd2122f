/*
 * どこで: DynDNS プロキシ API
 * 何を: DynDNS 互換の /nic/update を公開する
 * なぜ: 既存の DynDNS クライアント(ルーター等)から Cloudflare のレコードを更新できるようにするため
 */
package com.example.dyndns_proxy.api;

import com.example.dyndns_proxy.model.UpdateRequest;
import com.example.dyndns_proxy.service.ClientAddressResolver;
import com.example.dyndns_proxy.service.DynDnsUpdateService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class DynDnsUpdateController {

  private final DynDnsUpdateService dynDnsUpdateService;
  private final ClientAddressResolver clientAddressResolver;

  @GetMapping("/nic/update")
  public ResponseEntity<String> update(
      @RequestParam(name = "hostname", required = false) String hostname,
      @RequestParam(name = "myip", required = false) String myip,
      HttpServletRequest request) {
    final UpdateRequest updateRequest =
        new UpdateRequest(hostname, myip, clientAddressResolver.resolve(request));
    return DynDnsResponses.of(dynDnsUpdateService.update(updateRequest));
  }
}
